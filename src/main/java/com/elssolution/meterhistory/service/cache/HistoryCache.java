package com.elssolution.meterhistory.service.cache;

import com.elssolution.meterhistory.domain.HistoryResponse;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Response memo for the history engine.
 * Concurrent misses on one key may compute twice; the results are identical, so nothing is locked.
 */
public interface HistoryCache {

    /**
     * Returns the entry for {@code key} if it is younger than its TTL, otherwise computes,
     * stores and returns a fresh payload. Exceptions from {@code compute} propagate and store nothing.
     */
    HistoryResponse getOrCompute(CacheKey key, Duration ttl, Supplier<HistoryResponse> compute);

    /** Last payload stored for the key, fresh or expired. Used only for stale fallback. */
    Optional<HistoryResponse> lastKnown(CacheKey key);

    Stats stats();

    record Stats(long hits, long misses, long staleServed, long size, String hitRate) {

        public static Stats of(long hits, long misses, long staleServed, long size) {
            long total = hits + misses;
            double pct = (total == 0) ? 0.0 : (hits * 100.0 / total);
            return new Stats(hits, misses, staleServed, size, String.format(Locale.ROOT, "%.2f%%", pct));
        }
    }
}
