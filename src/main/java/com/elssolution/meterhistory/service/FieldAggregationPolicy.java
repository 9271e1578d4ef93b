package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.domain.AggregationKind;
import com.elssolution.meterhistory.domain.MetricField;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed field → aggregation table shared by both backends.
 * Mean on a counter understates the bucket's end state, so energy counters use max.
 */
@Component
public class FieldAggregationPolicy {

    private static final Map<MetricField, AggregationKind> TABLE;

    static {
        EnumMap<MetricField, AggregationKind> t = new EnumMap<>(MetricField.class);
        t.put(MetricField.POWER, AggregationKind.CONTINUOUS);
        t.put(MetricField.VOLTAGE, AggregationKind.CONTINUOUS);
        t.put(MetricField.CURRENT, AggregationKind.CONTINUOUS);
        t.put(MetricField.ENERGY_TODAY, AggregationKind.CUMULATIVE);
        t.put(MetricField.ENERGY_MONTH, AggregationKind.CUMULATIVE);
        t.put(MetricField.ENERGY_TOTAL, AggregationKind.CUMULATIVE);
        TABLE = Collections.unmodifiableMap(t);
    }

    public AggregationKind classify(MetricField field) {
        return TABLE.get(field);
    }

    /** Fields of one kind, in declaration order. */
    public List<MetricField> fieldsOf(AggregationKind kind) {
        return Arrays.stream(MetricField.values())
                .filter(f -> classify(f) == kind)
                .toList();
    }
}
