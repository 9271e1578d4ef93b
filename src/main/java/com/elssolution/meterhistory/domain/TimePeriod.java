package com.elssolution.meterhistory.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/** Dashboard period selector values. CUSTOM has no fixed duration. */
public enum TimePeriod {
    LAST_HOUR("1h", Duration.ofHours(1)),
    LAST_6_HOURS("6h", Duration.ofHours(6)),
    LAST_24_HOURS("24h", Duration.ofHours(24)),
    LAST_3_DAYS("3d", Duration.ofDays(3)),
    LAST_7_DAYS("7d", Duration.ofDays(7)),
    LAST_30_DAYS("30d", Duration.ofDays(30)),
    CUSTOM("custom", null);

    public static final TimePeriod DEFAULT = LAST_24_HOURS;

    private final String key;
    private final Duration duration;

    TimePeriod(String key, Duration duration) {
        this.key = key;
        this.duration = duration;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** @return fixed look-back of a preset period; null for CUSTOM */
    public Duration duration() {
        return duration;
    }

    public boolean isPreset() {
        return duration != null;
    }

    public static Optional<TimePeriod> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toLowerCase();
        return Arrays.stream(values()).filter(p -> p.key.equals(k)).findFirst();
    }
}
