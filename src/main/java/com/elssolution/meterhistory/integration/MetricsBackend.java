package com.elssolution.meterhistory.integration;

import com.elssolution.meterhistory.domain.BackendResult;
import com.elssolution.meterhistory.domain.DeviceDataRange;
import com.elssolution.meterhistory.domain.TimeWindow;

import java.time.Duration;

/**
 * Read side of one reading store. Exactly one implementation is active, chosen by {@code history.backend}.
 *
 * Implementations return bucket-start timestamps (clamped to the window start for the first, partial bucket),
 * ascending, with continuous fields averaged and cumulative fields maxed per bucket.
 * An unknown device yields an empty result; a store that cannot be reached throws
 * {@link BackendUnavailableException}.
 */
public interface MetricsBackend {

    /** Short stable id, part of the cache key and of response metadata. */
    String id();

    BackendResult query(String deviceId, TimeWindow window, Duration interval);

    DeviceDataRange dataRange(String deviceId);
}
