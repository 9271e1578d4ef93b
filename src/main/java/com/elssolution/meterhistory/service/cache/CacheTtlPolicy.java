package com.elssolution.meterhistory.service.cache;

import com.elssolution.meterhistory.domain.TimePeriod;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Longer periods change less per second, so they tolerate older answers. */
public final class CacheTtlPolicy {

    private static final Map<TimePeriod, Duration> TTL;

    static {
        EnumMap<TimePeriod, Duration> t = new EnumMap<>(TimePeriod.class);
        t.put(TimePeriod.LAST_HOUR, Duration.ofSeconds(30));
        t.put(TimePeriod.LAST_6_HOURS, Duration.ofSeconds(60));
        t.put(TimePeriod.LAST_24_HOURS, Duration.ofSeconds(300));
        t.put(TimePeriod.LAST_3_DAYS, Duration.ofSeconds(900));
        t.put(TimePeriod.LAST_7_DAYS, Duration.ofSeconds(1800));
        t.put(TimePeriod.LAST_30_DAYS, Duration.ofSeconds(3600));
        t.put(TimePeriod.CUSTOM, Duration.ofSeconds(300));
        TTL = Collections.unmodifiableMap(t);
    }

    private CacheTtlPolicy() {}

    public static Duration ttlFor(TimePeriod period) {
        return TTL.get(period);
    }
}
