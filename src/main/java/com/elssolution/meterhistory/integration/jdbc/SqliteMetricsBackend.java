package com.elssolution.meterhistory.integration.jdbc;

import com.elssolution.meterhistory.domain.AggregationKind;
import com.elssolution.meterhistory.domain.BackendResult;
import com.elssolution.meterhistory.domain.DeviceDataRange;
import com.elssolution.meterhistory.domain.MetricField;
import com.elssolution.meterhistory.domain.MetricPoint;
import com.elssolution.meterhistory.domain.TimeWindow;
import com.elssolution.meterhistory.integration.BackendUnavailableException;
import com.elssolution.meterhistory.integration.MetricsBackend;
import com.elssolution.meterhistory.service.FieldAggregationPolicy;
import com.elssolution.meterhistory.service.Intervals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Relational adapter over the {@code device_readings} table written by the ingestion side
 * (timestamps stored as UTC text "yyyy-MM-dd HH:mm:ss[.SSS]").
 *
 * Aggregation is a GROUP BY on epoch-aligned buckets, AVG for continuous and MAX for cumulative columns.
 * Intervals that are not a whole number of seconds cannot be bucketed this way; those queries
 * return raw rows and are flagged not aggregated. Either way at most {@code rowCap} stored rows
 * are read, newest first, so a capped result keeps the recent end of the window and is flagged truncated.
 */
@Slf4j
public class SqliteMetricsBackend implements MetricsBackend {

    public static final String ID = "relational";

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    /** Epoch millis of a stored timestamp text. */
    private static final String EPOCH_MS = "CAST(ROUND((julianday(%s) - 2440587.5) * 86400000) AS INTEGER)";

    private final JdbcTemplate jdbc;
    private final int rowCap;
    private final String aggregateSql;
    private final String rawSql;
    private final String rangeSql;
    private final String scannedSql;

    public SqliteMetricsBackend(JdbcTemplate jdbc, FieldAggregationPolicy policy, int rowCap) {
        this.jdbc = jdbc;
        this.rowCap = rowCap;

        String aggregates = Arrays.stream(MetricField.values())
                .map(f -> (policy.classify(f) == AggregationKind.CUMULATIVE ? "MAX(" : "AVG(")
                        + f.storageName() + ") AS " + f.storageName())
                .collect(Collectors.joining(", "));
        String columns = Arrays.stream(MetricField.values())
                .map(MetricField::storageName)
                .collect(Collectors.joining(", "));

        this.aggregateSql = "SELECT (CAST(strftime('%s', timestamp) AS INTEGER) / ?) * ? AS bucket_start, "
                + aggregates
                + " FROM (SELECT timestamp, " + columns + " FROM device_readings"
                + " WHERE device_ip = ? AND timestamp >= ? AND timestamp < ?"
                + " ORDER BY timestamp DESC LIMIT ?)"
                + " GROUP BY bucket_start ORDER BY bucket_start";
        this.scannedSql = "SELECT COUNT(*) FROM (SELECT 1 FROM device_readings"
                + " WHERE device_ip = ? AND timestamp >= ? AND timestamp < ? LIMIT ?)";
        this.rawSql = "SELECT " + EPOCH_MS.formatted("timestamp") + " AS ts_ms, " + columns
                + " FROM device_readings"
                + " WHERE device_ip = ? AND timestamp >= ? AND timestamp < ?"
                + " ORDER BY timestamp DESC LIMIT ?";
        this.rangeSql = "SELECT " + EPOCH_MS.formatted("MIN(timestamp)") + " AS earliest_ms, "
                + EPOCH_MS.formatted("MAX(timestamp)") + " AS latest_ms, COUNT(*) AS total"
                + " FROM device_readings WHERE device_ip = ?";
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public BackendResult query(String deviceId, TimeWindow window, Duration interval) {
        String from = TS.format(window.start());
        String to = TS.format(ceilToSecond(window.end()));
        try {
            if (!bucketable(interval)) {
                log.debug("sqlite_raw_fallback device={} interval={}", deviceId, Intervals.format(interval));
                List<MetricPoint> rows = jdbc.query(rawSql,
                        (rs, i) -> toPoint(Instant.ofEpochMilli(rs.getLong("ts_ms")), rs),
                        deviceId, from, to, rowCap + 1);
                List<MetricPoint> kept = new ArrayList<>(capped(rows));
                Collections.reverse(kept);
                return BackendResult.raw(kept, rows.size() > rowCap);
            }

            long bucketSec = interval.toSeconds();
            List<MetricPoint> rows = jdbc.query(aggregateSql,
                    (rs, i) -> toPoint(clamp(Instant.ofEpochSecond(rs.getLong("bucket_start")), window), rs),
                    bucketSec, bucketSec, deviceId, from, to, rowCap);
            Long scanned = jdbc.queryForObject(scannedSql, Long.class, deviceId, from, to, rowCap + 1);
            boolean truncated = scanned != null && scanned > rowCap;
            if (truncated) {
                log.warn("sqlite_row_cap_hit device={} cap={} interval={}", deviceId, rowCap, Intervals.format(interval));
            }
            log.debug("sqlite_query device={} interval={} buckets={}",
                    deviceId, Intervals.format(interval), rows.size());
            return BackendResult.aggregated(rows, truncated);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("sqlite query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public DeviceDataRange dataRange(String deviceId) {
        try {
            return jdbc.queryForObject(rangeSql, (rs, i) -> {
                long total = rs.getLong("total");
                if (total == 0) return DeviceDataRange.empty();
                return new DeviceDataRange(
                        Instant.ofEpochMilli(rs.getLong("earliest_ms")),
                        Instant.ofEpochMilli(rs.getLong("latest_ms")),
                        total);
            }, deviceId);
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("sqlite range probe failed: " + e.getMessage(), e);
        }
    }

    /** GROUP BY needs an integer bucket width in seconds. */
    static boolean bucketable(Duration interval) {
        return interval.toMillis() % 1000 == 0 && interval.toSeconds() >= 1;
    }

    /** The first bucket may start before the window; report it at the window start like the columnar side. */
    private static Instant clamp(Instant bucketStart, TimeWindow window) {
        return bucketStart.isBefore(window.start()) ? window.start() : bucketStart;
    }

    /** Stored text compares lexicographically at second precision, so the exclusive end rounds up. */
    private static Instant ceilToSecond(Instant t) {
        Instant floor = t.truncatedTo(ChronoUnit.SECONDS);
        return floor.equals(t) ? t : floor.plusSeconds(1);
    }

    private List<MetricPoint> capped(List<MetricPoint> rows) {
        return rows.size() > rowCap ? rows.subList(0, rowCap) : rows;
    }

    private static MetricPoint toPoint(Instant ts, ResultSet rs) throws SQLException {
        Map<MetricField, Double> values = new EnumMap<>(MetricField.class);
        for (MetricField f : MetricField.values()) {
            double v = rs.getDouble(f.storageName());
            values.put(f, rs.wasNull() ? null : v);
        }
        return MetricPoint.of(ts, values);
    }
}
