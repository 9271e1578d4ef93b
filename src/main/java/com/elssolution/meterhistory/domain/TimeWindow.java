package com.elssolution.meterhistory.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Canonical query window [start, end).
 *
 * @param period  the period the caller asked for (a hint only when bounds were explicit)
 * @param rolling   true when the bounds were derived from "now" and the period, not given by the caller
 * @param openEnded true when only the start was given and the end is "now"
 */
public record TimeWindow(Instant start, Instant end, TimePeriod period, boolean rolling, boolean openEnded) {

    public TimeWindow(Instant start, Instant end, TimePeriod period, boolean rolling) {
        this(start, end, period, rolling, false);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
