package com.elssolution.meterhistory.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Metric fields stored per reading.
 * The storage name is the same in both stores (InfluxDB field key and SQLite column).
 */
public enum MetricField {
    POWER("current_power_w"),
    VOLTAGE("voltage"),
    CURRENT("current"),
    ENERGY_TODAY("today_energy_kwh"),
    ENERGY_MONTH("month_energy_kwh"),
    ENERGY_TOTAL("total_energy_kwh");

    private static final Map<String, MetricField> BY_STORAGE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MetricField::storageName, Function.identity()));

    private final String storageName;

    MetricField(String storageName) {
        this.storageName = storageName;
    }

    public String storageName() {
        return storageName;
    }

    /** @return the field for a storage name, or null when the store returned something we don't model */
    public static MetricField fromStorageName(String name) {
        return name == null ? null : BY_STORAGE_NAME.get(name);
    }
}
