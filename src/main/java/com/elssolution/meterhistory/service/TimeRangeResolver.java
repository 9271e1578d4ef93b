package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.domain.TimePeriod;
import com.elssolution.meterhistory.domain.TimeWindow;
import com.elssolution.meterhistory.service.HistoryValidationException.Reason;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Turns (start_time?, end_time?, time_period?) into a validated window.
 *
 * Rules:
 * - no bounds: [now - period, now]; no period means 24h, and "custom" without bounds also falls back to 24h
 * - explicit bounds win over the period, which then only steers interval choice and cache TTL
 * - only start: end = now; only end: start = end - period (24h when none)
 * - future windows are fine, they just come back empty
 */
@Component
public class TimeRangeResolver {

    private final Clock clock;
    private final Duration maxRange;

    public TimeRangeResolver(Clock clock,
                             @Value("${history.query.maxRangeDays:90}") long maxRangeDays) {
        this.clock = clock;
        this.maxRange = Duration.ofDays(maxRangeDays);
    }

    /** Longest window accepted. */
    public Duration maxRange() {
        return maxRange;
    }

    public TimeWindow resolve(String startTime, String endTime, String periodKey) {
        TimePeriod period = parsePeriod(periodKey);
        Instant start = parseInstant(startTime, "start_time");
        Instant end = parseInstant(endTime, "end_time");
        Instant now = clock.instant();

        boolean rolling = false;
        boolean openEnded = false;
        if (start == null && end == null) {
            if (period == null) period = TimePeriod.DEFAULT;
            end = now;
            start = now.minus(lookBack(period));
            rolling = true;
        } else if (end == null) {
            end = now;
            openEnded = true;
        } else if (start == null) {
            start = end.minus(lookBack(period));
        }
        if (period == null) period = TimePeriod.CUSTOM;

        if (!start.isBefore(end)) {
            throw new HistoryValidationException(Reason.START_AFTER_END,
                    "start_time " + start + " must be before end_time " + end);
        }
        if (Duration.between(start, end).compareTo(maxRange) > 0) {
            throw new HistoryValidationException(Reason.RANGE_TOO_LONG,
                    "range " + start + " .. " + end + " exceeds " + maxRange.toDays() + " days");
        }
        return new TimeWindow(start, end, period, rolling, openEnded);
    }

    private static Duration lookBack(TimePeriod period) {
        return (period != null && period.isPreset()) ? period.duration() : TimePeriod.DEFAULT.duration();
    }

    private static TimePeriod parsePeriod(String key) {
        if (key == null || key.isBlank()) return null;
        return TimePeriod.fromKey(key).orElseThrow(() -> new HistoryValidationException(
                Reason.INVALID_PERIOD_KEY,
                "time_period must be one of 1h, 6h, 24h, 3d, 7d, 30d, custom: '" + key + "'"));
    }

    /** ISO-8601; a value without offset is read as UTC. */
    private static Instant parseInstant(String text, String name) {
        if (text == null || text.isBlank()) return null;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from);
            return (parsed instanceof OffsetDateTime odt)
                    ? odt.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new HistoryValidationException(Reason.INVALID_TIMESTAMP,
                    name + " is not an ISO-8601 timestamp: '" + text + "'");
        }
    }
}
