package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.domain.DataRangeView;
import com.elssolution.meterhistory.domain.DeviceDataRange;
import com.elssolution.meterhistory.integration.MetricsBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeoutException;

/** Data-availability probe, so a client can check a custom window before asking for it. */
@Slf4j
@Service
public class DataRangeService {

    private final MetricsBackend backend;
    private final BackendCallExecutor calls;

    public DataRangeService(MetricsBackend backend, BackendCallExecutor calls) {
        this.backend = backend;
        this.calls = calls;
    }

    public DataRangeView dataRange(String deviceId) {
        DeviceDataRange range;
        try {
            range = calls.call("data-range " + backend.id(), () -> backend.dataRange(deviceId));
        } catch (TimeoutException e) {
            throw new HistoryServiceException(HistoryServiceException.Reason.QUERY_TIMEOUT_EXHAUSTED,
                    "data range probe timed out for device " + deviceId, e);
        }
        log.debug("data_range device={} records={} earliest={} latest={}",
                deviceId, range.totalRecords(), range.earliest(), range.latest());
        return DataRangeView.from(range);
    }
}
