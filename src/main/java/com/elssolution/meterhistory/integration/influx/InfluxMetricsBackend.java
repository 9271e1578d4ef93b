package com.elssolution.meterhistory.integration.influx;

import com.elssolution.meterhistory.domain.AggregationKind;
import com.elssolution.meterhistory.domain.BackendResult;
import com.elssolution.meterhistory.domain.DeviceDataRange;
import com.elssolution.meterhistory.domain.MetricField;
import com.elssolution.meterhistory.domain.MetricPoint;
import com.elssolution.meterhistory.domain.TimeWindow;
import com.elssolution.meterhistory.integration.MetricsBackend;
import com.elssolution.meterhistory.service.FieldAggregationPolicy;
import com.elssolution.meterhistory.service.Intervals;
import com.influxdb.query.FluxRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Columnar adapter (InfluxDB 2.x, Flux).
 *
 * One script per query: the continuous group goes through aggregateWindow(fn: mean), the cumulative
 * group through aggregateWindow(fn: max), both stamped with the window start, then union-ed.
 * Records come back one per (bucket, field); they are joined here on bucket start.
 */
@Slf4j
public class InfluxMetricsBackend implements MetricsBackend {

    public static final String ID = "columnar";

    private static final String EPOCH = "1970-01-01T00:00:00Z";

    private final ColumnarReadClient client;
    private final FieldAggregationPolicy policy;
    private final String bucket;
    private final String measurement;

    public InfluxMetricsBackend(ColumnarReadClient client, FieldAggregationPolicy policy,
                                String bucket, String measurement) {
        this.client = client;
        this.policy = policy;
        this.bucket = bucket;
        this.measurement = measurement;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public BackendResult query(String deviceId, TimeWindow window, Duration interval) {
        String flux = aggregationQuery(deviceId, window, interval);
        List<FluxRecord> records = client.query(flux);

        TreeMap<Instant, Map<MetricField, Double>> buckets = new TreeMap<>();
        for (FluxRecord r : records) {
            Instant t = r.getTime();
            MetricField field = MetricField.fromStorageName(r.getField());
            if (t == null || field == null) continue;
            Double value = (r.getValue() instanceof Number n) ? n.doubleValue() : null;
            buckets.computeIfAbsent(t, k -> new EnumMap<>(MetricField.class)).put(field, value);
        }

        List<MetricPoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((t, values) -> points.add(MetricPoint.of(t, values)));
        log.debug("influx_query device={} interval={} records={} buckets={}",
                deviceId, Intervals.format(interval), records.size(), points.size());
        return BackendResult.aggregated(points, false);
    }

    @Override
    public DeviceDataRange dataRange(String deviceId) {
        List<FluxRecord> count = client.query(probe(deviceId) + "\n  |> count()");
        long total = count.isEmpty() || !(count.get(0).getValue() instanceof Number n) ? 0L : n.longValue();
        if (total == 0) return DeviceDataRange.empty();

        Instant earliest = firstTime(client.query(probe(deviceId)
                + "\n  |> sort(columns: [\"_time\"])\n  |> limit(n: 1)"));
        Instant latest = firstTime(client.query(probe(deviceId)
                + "\n  |> sort(columns: [\"_time\"], desc: true)\n  |> limit(n: 1)"));
        return new DeviceDataRange(earliest, latest, total);
    }

    String aggregationQuery(String deviceId, TimeWindow window, Duration interval) {
        String every = Intervals.format(interval);
        return fieldGroup("continuous", deviceId, window, AggregationKind.CONTINUOUS, every, "mean")
                + fieldGroup("cumulative", deviceId, window, AggregationKind.CUMULATIVE, every, "max")
                + "union(tables: [continuous, cumulative])\n"
                + "  |> keep(columns: [\"_time\", \"_field\", \"_value\"])\n";
    }

    private String fieldGroup(String name, String deviceId, TimeWindow window,
                              AggregationKind kind, String every, String fn) {
        String fieldFilter = policy.fieldsOf(kind).stream()
                .map(f -> "r._field == \"" + f.storageName() + "\"")
                .collect(Collectors.joining(" or "));
        return name + " = from(bucket: \"" + escape(bucket) + "\")\n"
                + "  |> range(start: " + window.start() + ", stop: " + window.end() + ")\n"
                + "  |> filter(fn: (r) => r._measurement == \"" + escape(measurement)
                + "\" and r.device_ip == \"" + escape(deviceId) + "\")\n"
                + "  |> filter(fn: (r) => " + fieldFilter + ")\n"
                + "  |> aggregateWindow(every: " + every + ", fn: " + fn
                + ", createEmpty: false, timeSrc: \"_start\")\n";
    }

    /** Power samples stand in for "one reading"; every stored reading carries it. */
    private String probe(String deviceId) {
        return "from(bucket: \"" + escape(bucket) + "\")\n"
                + "  |> range(start: " + EPOCH + ")\n"
                + "  |> filter(fn: (r) => r._measurement == \"" + escape(measurement)
                + "\" and r.device_ip == \"" + escape(deviceId)
                + "\" and r._field == \"" + MetricField.POWER.storageName() + "\")\n"
                + "  |> group()";
    }

    private static Instant firstTime(List<FluxRecord> records) {
        return records.isEmpty() ? null : records.get(0).getTime();
    }

    static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
