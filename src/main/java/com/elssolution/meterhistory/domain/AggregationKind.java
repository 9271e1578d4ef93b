package com.elssolution.meterhistory.domain;

/**
 * How a field is summarized inside one bucket.
 * CONTINUOUS → arithmetic mean, CUMULATIVE → maximum (counters only grow within their reset period).
 */
public enum AggregationKind {
    CONTINUOUS,
    CUMULATIVE
}
