package com.elssolution.meterhistory.domain;

import java.time.Duration;
import java.time.Instant;

/** Wire shape of the data-availability probe. Null timestamps are serialized as null, not omitted. */
public record DataRangeView(Instant earliestTimestamp,
                            Instant latestTimestamp,
                            long totalDays,
                            long totalRecords,
                            boolean hasData) {

    private static final long MS_PER_DAY = Duration.ofDays(1).toMillis();

    public static DataRangeView from(DeviceDataRange range) {
        if (!range.hasData()) {
            return new DataRangeView(null, null, 0, 0, false);
        }
        long spanMs = Duration.between(range.earliest(), range.latest()).toMillis();
        long days = Math.max(1, (spanMs + MS_PER_DAY - 1) / MS_PER_DAY);
        return new DataRangeView(range.earliest(), range.latest(), days, range.totalRecords(), true);
    }
}
