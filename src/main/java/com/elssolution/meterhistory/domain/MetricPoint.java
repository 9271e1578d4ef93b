package com.elssolution.meterhistory.domain;

import java.time.Instant;
import java.util.Map;

/**
 * One (possibly aggregated) reading. Missing values stay null; a null is never replaced by 0.
 */
public record MetricPoint(Instant timestamp,
                          Double powerW,
                          Double voltageV,
                          Double currentA,
                          Double energyTodayKwh,
                          Double energyMonthKwh,
                          Double energyTotalKwh) {

    public static MetricPoint of(Instant timestamp, Map<MetricField, Double> values) {
        return new MetricPoint(timestamp,
                values.get(MetricField.POWER),
                values.get(MetricField.VOLTAGE),
                values.get(MetricField.CURRENT),
                values.get(MetricField.ENERGY_TODAY),
                values.get(MetricField.ENERGY_MONTH),
                values.get(MetricField.ENERGY_TOTAL));
    }

    public Double value(MetricField field) {
        return switch (field) {
            case POWER -> powerW;
            case VOLTAGE -> voltageV;
            case CURRENT -> currentA;
            case ENERGY_TODAY -> energyTodayKwh;
            case ENERGY_MONTH -> energyMonthKwh;
            case ENERGY_TOTAL -> energyTotalKwh;
        };
    }

    public boolean hasMissingField() {
        for (MetricField f : MetricField.values()) {
            if (value(f) == null) return true;
        }
        return false;
    }
}
