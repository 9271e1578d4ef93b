package com.elssolution.meterhistory.service.cache;

import com.elssolution.meterhistory.domain.HistoryResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Size-bounded store of {@link CacheEntry}s. Freshness is judged against the injected clock
 * on every read, so expired entries linger (until size eviction) and can back a stale fallback.
 */
@Slf4j
@Component
public class CaffeineHistoryCache implements HistoryCache {

    private final Clock clock;
    private final Cache<CacheKey, CacheEntry> entries;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong staleServed = new AtomicLong();

    public CaffeineHistoryCache(Clock clock,
                                @Value("${history.cache.maxEntries:1000}") long maxEntries) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .executor(Runnable::run)
                .build();
        log.info("History cache ready: maxEntries={}", maxEntries);
    }

    @Override
    public HistoryResponse getOrCompute(CacheKey key, Duration ttl, Supplier<HistoryResponse> compute) {
        Instant now = clock.instant();
        CacheEntry cached = entries.getIfPresent(key);
        if (cached != null && cached.isFreshAt(now)) {
            hits.incrementAndGet();
            if (log.isDebugEnabled()) {
                log.debug("history_cache_hit device={} period={} age={}ms",
                        key.deviceId(), key.period().key(),
                        Duration.between(cached.computedAt(), now).toMillis());
            }
            return cached.payload();
        }

        misses.incrementAndGet();
        HistoryResponse payload = compute.get();
        entries.put(key, new CacheEntry(key, payload, clock.instant(), ttl));
        log.debug("history_cache_store device={} period={} ttl={}s",
                key.deviceId(), key.period().key(), ttl.toSeconds());
        return payload;
    }

    @Override
    public Optional<HistoryResponse> lastKnown(CacheKey key) {
        CacheEntry cached = entries.getIfPresent(key);
        if (cached == null) return Optional.empty();
        staleServed.incrementAndGet();
        return Optional.of(cached.payload());
    }

    @Override
    public Stats stats() {
        return Stats.of(hits.get(), misses.get(), staleServed.get(), entries.estimatedSize());
    }
}
