package com.elssolution.meterhistory.service;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interval literals in the form {@code <n>(ms|s|m|h|d)}, e.g. "15m", "1556s", "500ms".
 * The same literals are valid Flux durations.
 */
public final class Intervals {

    private static final Pattern LITERAL = Pattern.compile("^(\\d+)(ms|s|m|h|d)$");

    private Intervals() {}

    /** @return null for a blank input (no override) */
    public static Duration parse(String text) {
        return parse(text, null);
    }

    /**
     * @param max longest accepted interval; null for no limit
     * @return null for a blank input (no override)
     */
    public static Duration parse(String text, Duration max) {
        if (text == null || text.isBlank()) return null;
        Matcher m = LITERAL.matcher(text.trim().toLowerCase());
        if (!m.matches()) {
            throw new HistoryValidationException(HistoryValidationException.Reason.INVALID_INTERVAL,
                    "interval must look like 30s, 15m, 1h or 1d: '" + text + "'");
        }
        long n;
        try {
            n = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw new HistoryValidationException(HistoryValidationException.Reason.INVALID_INTERVAL,
                    "interval out of range: '" + text + "'");
        }
        if (n <= 0) {
            throw new HistoryValidationException(HistoryValidationException.Reason.INVALID_INTERVAL,
                    "interval must be positive: '" + text + "'");
        }
        Duration d;
        try {
            d = switch (m.group(2)) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                default -> Duration.ofDays(n);
            };
            d.toMillis(); // everything downstream works in millis
        } catch (ArithmeticException e) {
            throw new HistoryValidationException(HistoryValidationException.Reason.INVALID_INTERVAL,
                    "interval out of range: '" + text + "'");
        }
        if (max != null && d.compareTo(max) > 0) {
            throw new HistoryValidationException(HistoryValidationException.Reason.INVALID_INTERVAL,
                    "interval must not exceed " + format(max) + ": '" + text + "'");
        }
        return d;
    }

    /** Largest whole unit that represents the duration exactly. */
    public static String format(Duration d) {
        long ms = d.toMillis();
        if (ms % 1000 != 0) return ms + "ms";
        long s = ms / 1000;
        if (s % 86_400 == 0) return (s / 86_400) + "d";
        if (s % 3_600 == 0) return (s / 3_600) + "h";
        if (s % 60 == 0) return (s / 60) + "m";
        return s + "s";
    }
}
