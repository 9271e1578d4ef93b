package com.elssolution.meterhistory.domain;

import java.util.List;

/**
 * Raw output of a backend adapter, before assembly.
 *
 * @param aggregated false only when the adapter fell back to unaggregated rows
 * @param truncated  true when the row cap cut the result short
 */
public record BackendResult(List<MetricPoint> points, boolean aggregated, boolean truncated) {

    public static BackendResult aggregated(List<MetricPoint> points, boolean truncated) {
        return new BackendResult(List.copyOf(points), true, truncated);
    }

    public static BackendResult raw(List<MetricPoint> points, boolean truncated) {
        return new BackendResult(List.copyOf(points), false, truncated);
    }

    public static BackendResult empty() {
        return new BackendResult(List.of(), true, false);
    }
}
