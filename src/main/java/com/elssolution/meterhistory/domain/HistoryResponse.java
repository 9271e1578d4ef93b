package com.elssolution.meterhistory.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/** Public response of the history query. Immutable, so a cached instance can be handed out as-is. */
public record HistoryResponse(List<MetricPoint> data, Metadata metadata) {

    public HistoryResponse {
        data = List.copyOf(data);
    }

    /** Same payload, flagged as served from an expired cache entry. */
    public HistoryResponse asStale() {
        return new HistoryResponse(data, metadata.withStale());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Metadata(TimePeriod timePeriod,
                           Instant startTime,
                           Instant endTime,
                           String interval,
                           String requestedInterval,
                           int dataPoints,
                           boolean aggregated,
                           boolean truncated,
                           boolean stale,
                           String backend) {

        Metadata withStale() {
            return new Metadata(timePeriod, startTime, endTime, interval, requestedInterval,
                    dataPoints, aggregated, truncated, true, backend);
        }
    }
}
