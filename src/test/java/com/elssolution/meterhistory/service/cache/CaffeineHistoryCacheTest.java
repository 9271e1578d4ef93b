package com.elssolution.meterhistory.service.cache;

import com.elssolution.meterhistory.domain.HistoryResponse;
import com.elssolution.meterhistory.domain.TimePeriod;
import com.elssolution.meterhistory.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineHistoryCacheTest {

    private static final Duration TTL = Duration.ofSeconds(300);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-08-20T12:00:00Z"));
    private final CaffeineHistoryCache cache = new CaffeineHistoryCache(clock, 100);
    private final AtomicInteger computed = new AtomicInteger();

    private static CacheKey key(String device) {
        return new CacheKey(device, null, null, TimePeriod.LAST_24_HOURS, Duration.ofMinutes(15), null, "relational");
    }

    private HistoryResponse payload() {
        int n = computed.incrementAndGet();
        return new HistoryResponse(List.of(), new HistoryResponse.Metadata(TimePeriod.LAST_24_HOURS,
                null, null, "15m", null, n, true, false, false, "relational"));
    }

    @Test
    void second_read_within_ttl_is_a_hit() {
        HistoryResponse first = cache.getOrCompute(key("a"), TTL, this::payload);
        clock.advance(Duration.ofSeconds(299));
        HistoryResponse second = cache.getOrCompute(key("a"), TTL, this::payload);

        assertThat(second).isSameAs(first);
        assertThat(computed).hasValue(1);
        assertThat(cache.stats().hits()).isEqualTo(1);
        assertThat(cache.stats().misses()).isEqualTo(1);
        assertThat(cache.stats().hitRate()).isEqualTo("50.00%");
    }

    @Test
    void entry_past_ttl_is_recomputed() {
        cache.getOrCompute(key("a"), TTL, this::payload);
        clock.advance(TTL);
        HistoryResponse again = cache.getOrCompute(key("a"), TTL, this::payload);

        assertThat(computed).hasValue(2);
        assertThat(again.metadata().dataPoints()).isEqualTo(2);
    }

    @Test
    void keys_do_not_share_entries() {
        cache.getOrCompute(key("a"), TTL, this::payload);
        cache.getOrCompute(key("b"), TTL, this::payload);

        assertThat(computed).hasValue(2);
        assertThat(cache.stats().size()).isEqualTo(2);
    }

    @Test
    void failures_are_not_cached() {
        assertThatThrownBy(() -> cache.getOrCompute(key("a"), TTL, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.lastKnown(key("a"))).isEmpty();
        cache.getOrCompute(key("a"), TTL, this::payload);
        assertThat(computed).hasValue(1);
    }

    @Test
    void expired_entry_is_still_known_for_fallback() {
        HistoryResponse first = cache.getOrCompute(key("a"), TTL, this::payload);
        clock.advance(Duration.ofHours(2));

        assertThat(cache.lastKnown(key("a"))).containsSame(first);
        assertThat(cache.stats().staleServed()).isEqualTo(1);
    }

    @Test
    void empty_cache_reports_zero_hit_rate() {
        assertThat(cache.stats().hitRate()).isEqualTo("0.00%");
    }
}
