package com.elssolution.meterhistory.domain;

import java.time.Duration;

/**
 * Effective bucket size for one query.
 *
 * @param interval  the interval actually used
 * @param requested what was asked for (explicitly, or the first choice before widening); null if nothing was substituted
 */
public record AggregationSpec(Duration interval, Duration requested) {

    public static AggregationSpec of(Duration interval) {
        return new AggregationSpec(interval, null);
    }

    public boolean substituted() {
        return requested != null && !requested.equals(interval);
    }

    /** Twice the bucket size; keeps the original request for disclosure. */
    public AggregationSpec widened() {
        return new AggregationSpec(interval.multipliedBy(2), requested != null ? requested : interval);
    }

    public static long pointsFor(Duration window, Duration interval) {
        long w = window.toMillis();
        long i = interval.toMillis();
        return (w + i - 1) / i;
    }
}
