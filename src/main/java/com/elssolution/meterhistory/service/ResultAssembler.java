package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.domain.AggregationSpec;
import com.elssolution.meterhistory.domain.BackendResult;
import com.elssolution.meterhistory.domain.HistoryResponse;
import com.elssolution.meterhistory.domain.MetricPoint;
import com.elssolution.meterhistory.domain.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Shapes adapter output into the public response.
 * Guarantees ascending unique timestamps and data_points == data.size().
 */
@Slf4j
@Component
public class ResultAssembler {

    public HistoryResponse assemble(String deviceId, TimeWindow window, AggregationSpec spec,
                                    String backendId, BackendResult result) {
        List<MetricPoint> sorted = result.points().stream()
                .filter(p -> p.timestamp() != null)
                .sorted(Comparator.comparing(MetricPoint::timestamp))
                .toList();

        List<MetricPoint> data = new ArrayList<>(sorted.size());
        Instant prev = null;
        int missing = 0;
        for (MetricPoint p : sorted) {
            if (Objects.equals(prev, p.timestamp())) continue; // keep the first of a duplicate run
            data.add(p);
            prev = p.timestamp();
            if (p.hasMissingField()) missing++;
        }

        if (data.size() != result.points().size()) {
            log.warn("history_points_dropped device={} backend={} in={} out={}",
                    deviceId, backendId, result.points().size(), data.size());
        }
        if (missing > 0) {
            log.warn("data_integrity_missing_fields device={} backend={} points={} (left null)",
                    deviceId, backendId, missing);
        }

        HistoryResponse.Metadata metadata = new HistoryResponse.Metadata(
                window.period(),
                window.start(),
                window.end(),
                Intervals.format(spec.interval()),
                spec.substituted() ? Intervals.format(spec.requested()) : null,
                data.size(),
                result.aggregated(),
                result.truncated(),
                false,
                backendId);
        return new HistoryResponse(data, metadata);
    }
}
