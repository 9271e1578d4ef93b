package com.elssolution.meterhistory.service.cache;

import com.elssolution.meterhistory.domain.HistoryResponse;

import java.time.Duration;
import java.time.Instant;

/** Immutable; an expired entry is replaced, never refreshed in place. */
public record CacheEntry(CacheKey key, HistoryResponse payload, Instant computedAt, Duration ttl) {

    public boolean isFreshAt(Instant now) {
        return now.isBefore(computedAt.plus(ttl));
    }
}
