package com.elssolution.meterhistory.service.cache;

import com.elssolution.meterhistory.domain.AggregationSpec;
import com.elssolution.meterhistory.domain.TimePeriod;
import com.elssolution.meterhistory.domain.TimeWindow;

import java.time.Duration;
import java.time.Instant;

/**
 * Identity of a computed response.
 * Rolling windows ("last 24h" with no bounds) are keyed by their period, not by their now-anchored
 * bounds, so repeated polls within the TTL share one entry. Open-ended windows (start only) keep
 * their start and drop the now-anchored end for the same reason.
 */
public record CacheKey(String deviceId,
                       Instant start,
                       Instant end,
                       TimePeriod period,
                       Duration interval,
                       Duration requestedInterval,
                       String backend) {

    public static CacheKey of(String deviceId, TimeWindow window, AggregationSpec spec, String backend) {
        return new CacheKey(deviceId,
                window.rolling() ? null : window.start(),
                window.rolling() || window.openEnded() ? null : window.end(),
                window.period(),
                spec.interval(),
                spec.requested(),
                backend);
    }
}
