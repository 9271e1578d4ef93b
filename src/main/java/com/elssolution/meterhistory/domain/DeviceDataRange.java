package com.elssolution.meterhistory.domain;

import java.time.Instant;

/** What a store holds for one device. Timestamps are null when there are no records. */
public record DeviceDataRange(Instant earliest, Instant latest, long totalRecords) {

    public static DeviceDataRange empty() {
        return new DeviceDataRange(null, null, 0);
    }

    public boolean hasData() {
        return totalRecords > 0 && earliest != null && latest != null;
    }
}
