package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.domain.AggregationSpec;
import com.elssolution.meterhistory.domain.TimePeriod;
import com.elssolution.meterhistory.domain.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the bucket size for a window.
 *
 * Table (period → interval): 1h→1m, 6h→5m, 24h→15m, 3d→1h, 7d→4h, 30d→12h.
 * Custom windows take the interval of the smallest table period that covers them.
 * Whatever the candidate, it is replaced by ceil(window / maxPoints) (whole seconds)
 * when it would yield more than maxPoints buckets; the substitution is kept in the spec.
 */
@Slf4j
@Component
public class IntervalSelector {

    static final Map<TimePeriod, Duration> TABLE;

    static {
        EnumMap<TimePeriod, Duration> t = new EnumMap<>(TimePeriod.class);
        t.put(TimePeriod.LAST_HOUR, Duration.ofMinutes(1));
        t.put(TimePeriod.LAST_6_HOURS, Duration.ofMinutes(5));
        t.put(TimePeriod.LAST_24_HOURS, Duration.ofMinutes(15));
        t.put(TimePeriod.LAST_3_DAYS, Duration.ofHours(1));
        t.put(TimePeriod.LAST_7_DAYS, Duration.ofHours(4));
        t.put(TimePeriod.LAST_30_DAYS, Duration.ofHours(12));
        TABLE = Collections.unmodifiableMap(t);
    }

    private final long maxPoints;

    public IntervalSelector(@Value("${history.query.maxPoints:5000}") long maxPoints) {
        this.maxPoints = maxPoints;
    }

    /**
     * @param override interval the caller asked for explicitly; null when none
     */
    public AggregationSpec select(TimeWindow window, Duration override) {
        Duration length = window.duration();
        Duration candidate = (override != null) ? override : tableInterval(window.period(), length);

        if (candidate != null && AggregationSpec.pointsFor(length, candidate) <= maxPoints) {
            return AggregationSpec.of(candidate);
        }

        Duration ceiling = ceilingInterval(length);
        log.debug("interval_widened window={} candidate={} → {}", length, candidate, ceiling);
        return new AggregationSpec(ceiling, override);
    }

    private static Duration tableInterval(TimePeriod period, Duration length) {
        if (period.isPreset()) return TABLE.get(period);
        for (TimePeriod p : TimePeriod.values()) {   // declaration order = ascending duration
            if (p.isPreset() && p.duration().compareTo(length) >= 0) return TABLE.get(p);
        }
        return null; // longer than the largest table entry
    }

    /** Smallest whole-second interval keeping the bucket count within maxPoints. */
    Duration ceilingInterval(Duration length) {
        long ms = (length.toMillis() + maxPoints - 1) / maxPoints;
        long seconds = Math.max(1, (ms + 999) / 1000);
        return Duration.ofSeconds(seconds);
    }
}
