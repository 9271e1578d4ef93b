package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.alerts.AlertService;
import com.elssolution.meterhistory.domain.HistoryResponse;
import com.elssolution.meterhistory.domain.TimePeriod;
import com.elssolution.meterhistory.service.cache.CaffeineHistoryCache;
import com.elssolution.meterhistory.testutil.FakeBackend;
import com.elssolution.meterhistory.testutil.FakeBackend.Mode;
import com.elssolution.meterhistory.testutil.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HistoryQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-08-20T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final AlertService alerts = new AlertService(clock);
    private final FakeBackend backend = new FakeBackend();
    private final CaffeineHistoryCache cache = new CaffeineHistoryCache(clock, 100);
    private final HistoryQueryService service = new HistoryQueryService(
            new TimeRangeResolver(clock, 90),
            new IntervalSelector(5000),
            cache,
            backend,
            new BackendCallExecutor(pool, alerts, 200),
            new ResultAssembler());

    private final ObjectMapper json = new ObjectMapper().findAndRegisterModules();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void last_24h_uses_15m_buckets() {
        HistoryResponse r = service.history("10.0.0.5", null, null, "24h", null);

        HistoryResponse.Metadata m = r.metadata();
        assertThat(m.timePeriod()).isEqualTo(TimePeriod.LAST_24_HOURS);
        assertThat(m.startTime()).isEqualTo(NOW.minus(Duration.ofHours(24)));
        assertThat(m.endTime()).isEqualTo(NOW);
        assertThat(m.interval()).isEqualTo("15m");
        assertThat(m.dataPoints()).isEqualTo(96).isEqualTo(r.data().size());
        assertThat(m.stale()).isFalse();
        assertThat(r.data().get(0).timestamp()).isEqualTo(m.startTime());
    }

    @Test
    void custom_15_days_uses_12h_buckets() {
        HistoryResponse r = service.history("10.0.0.5",
                "2024-08-01T00:00:00Z", "2024-08-16T00:00:00Z", "custom", null);

        assertThat(r.metadata().interval()).isEqualTo("12h");
        assertThat(r.metadata().dataPoints()).isEqualTo(30);
    }

    @Test
    void invalid_window_never_reaches_the_backend() {
        assertThatThrownBy(() -> service.history("10.0.0.5",
                "2024-08-02T00:00:00Z", "2024-08-01T00:00:00Z", "custom", null))
                .isInstanceOf(HistoryValidationException.class)
                .extracting("reason").isEqualTo(HistoryValidationException.Reason.START_AFTER_END);
        assertThatThrownBy(() -> service.history("10.0.0.5", null, null, "24h", "fast"))
                .isInstanceOf(HistoryValidationException.class);

        assertThat(backend.calls()).isZero();
    }

    @Test
    void oversized_interval_is_a_validation_error() {
        for (String huge : new String[]{"200000000000d", "9999999999999999d", "91d"}) {
            assertThatThrownBy(() -> service.history("10.0.0.5", null, null, "24h", huge))
                    .as(huge)
                    .isInstanceOf(HistoryValidationException.class)
                    .extracting("reason").isEqualTo(HistoryValidationException.Reason.INVALID_INTERVAL);
        }
        assertThat(backend.calls()).isZero();
    }

    @Test
    void repeat_within_ttl_is_served_from_cache_unchanged() throws Exception {
        HistoryResponse first = service.history("10.0.0.5", null, null, "24h", null);
        clock.advance(Duration.ofSeconds(120));
        HistoryResponse second = service.history("10.0.0.5", null, null, "24h", null);

        assertThat(backend.calls()).isEqualTo(1);
        assertThat(json.writeValueAsString(second)).isEqualTo(json.writeValueAsString(first));
    }

    @Test
    void start_only_window_is_served_from_cache_within_ttl() {
        service.history("10.0.0.5", "2024-08-20T00:00:00Z", null, null, null);
        clock.advance(Duration.ofSeconds(30));
        HistoryResponse again = service.history("10.0.0.5", "2024-08-20T00:00:00Z", null, null, null);

        assertThat(backend.calls()).isEqualTo(1);
        assertThat(again.metadata().startTime()).isEqualTo(Instant.parse("2024-08-20T00:00:00Z"));
    }

    @Test
    void start_only_window_falls_back_to_stale_entry() {
        service.history("10.0.0.5", "2024-08-20T00:00:00Z", null, null, null);
        clock.advance(Duration.ofSeconds(301));
        backend.then(Mode.FAIL);

        HistoryResponse r = service.history("10.0.0.5", "2024-08-20T00:00:00Z", null, null, null);

        assertThat(r.metadata().stale()).isTrue();
    }

    @Test
    void repeat_after_ttl_queries_again() {
        service.history("10.0.0.5", null, null, "24h", null);
        clock.advance(Duration.ofSeconds(301));
        HistoryResponse again = service.history("10.0.0.5", null, null, "24h", null);

        assertThat(backend.calls()).isEqualTo(2);
        assertThat(again.metadata().endTime()).isEqualTo(NOW.plusSeconds(301));
    }

    @Test
    void fine_interval_override_is_widened_and_disclosed() {
        HistoryResponse r = service.history("10.0.0.5", null, null, "24h", "1s");

        assertThat(r.metadata().interval()).isEqualTo("18s");
        assertThat(r.metadata().requestedInterval()).isEqualTo("1s");
        assertThat(r.metadata().dataPoints()).isLessThanOrEqualTo(5000);
    }

    @Test
    void one_timeout_is_retried_with_a_wider_interval() {
        backend.then(Mode.HANG);

        HistoryResponse r = service.history("10.0.0.5", null, null, "24h", null);

        assertThat(backend.intervals()).containsExactly(Duration.ofMinutes(15), Duration.ofMinutes(30));
        assertThat(r.metadata().interval()).isEqualTo("30m");
        assertThat(r.metadata().requestedInterval()).isEqualTo("15m");
        assertThat(r.metadata().dataPoints()).isEqualTo(48);
        assertThat(r.metadata().stale()).isFalse();
    }

    @Test
    void two_timeouts_serve_the_expired_entry_as_stale() {
        HistoryResponse fresh = service.history("10.0.0.5", null, null, "24h", null);
        clock.advance(Duration.ofSeconds(301));
        backend.then(Mode.HANG, Mode.HANG);

        HistoryResponse r = service.history("10.0.0.5", null, null, "24h", null);

        assertThat(r.metadata().stale()).isTrue();
        assertThat(r.data()).isEqualTo(fresh.data());
        assertThat(backend.intervals()).containsExactly(
                Duration.ofMinutes(15), Duration.ofMinutes(15), Duration.ofMinutes(30));
        assertThat(alerts.isActive(AlertService.BACKEND_TIMEOUT)).isTrue();
    }

    @Test
    void two_timeouts_without_cache_fail() {
        backend.then(Mode.HANG, Mode.HANG);

        assertThatThrownBy(() -> service.history("10.0.0.5", null, null, "24h", null))
                .isInstanceOf(HistoryServiceException.class)
                .extracting("reason").isEqualTo(HistoryServiceException.Reason.QUERY_TIMEOUT_EXHAUSTED);
    }

    @Test
    void unavailable_backend_is_not_retried() {
        backend.then(Mode.FAIL);

        assertThatThrownBy(() -> service.history("10.0.0.5", null, null, "24h", null))
                .isInstanceOf(HistoryServiceException.class)
                .extracting("reason").isEqualTo(HistoryServiceException.Reason.BACKEND_UNAVAILABLE);
        assertThat(backend.calls()).isEqualTo(1);
        assertThat(alerts.isActive(AlertService.BACKEND_UNAVAILABLE)).isTrue();
    }

    @Test
    void failure_is_not_cached_and_recovery_clears_the_alert() {
        backend.then(Mode.FAIL);
        assertThatThrownBy(() -> service.history("10.0.0.5", null, null, "24h", null))
                .isInstanceOf(HistoryServiceException.class);

        HistoryResponse r = service.history("10.0.0.5", null, null, "24h", null);

        assertThat(r.metadata().stale()).isFalse();
        assertThat(backend.calls()).isEqualTo(2);
        assertThat(alerts.isActive(AlertService.BACKEND_UNAVAILABLE)).isFalse();
    }

    @Test
    void adapter_bug_is_not_covered_by_stale_data() {
        service.history("10.0.0.5", null, null, "24h", null);
        clock.advance(Duration.ofSeconds(301));
        backend.then(Mode.BUG);

        assertThatThrownBy(() -> service.history("10.0.0.5", null, null, "24h", null))
                .isInstanceOf(NullPointerException.class);
        assertThat(alerts.isActive(AlertService.BACKEND_UNAVAILABLE)).isFalse();
        assertThat(cache.stats().staleServed()).isZero();
    }

    @Test
    void unavailable_backend_with_cached_entry_serves_stale() {
        service.history("10.0.0.5", "2024-08-01T00:00:00Z", "2024-08-02T00:00:00Z", null, null);
        clock.advance(Duration.ofHours(1));
        backend.then(Mode.FAIL);

        HistoryResponse r = service.history("10.0.0.5", "2024-08-01T00:00:00Z", "2024-08-02T00:00:00Z", null, null);

        assertThat(r.metadata().stale()).isTrue();
        assertThat(cache.stats().staleServed()).isEqualTo(1);
    }
}
