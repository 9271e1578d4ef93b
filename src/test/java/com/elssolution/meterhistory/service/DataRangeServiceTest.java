package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.alerts.AlertService;
import com.elssolution.meterhistory.domain.DataRangeView;
import com.elssolution.meterhistory.domain.DeviceDataRange;
import com.elssolution.meterhistory.testutil.FakeBackend;
import com.elssolution.meterhistory.testutil.FakeBackend.Mode;
import com.elssolution.meterhistory.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataRangeServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-08-20T12:00:00Z"));
    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final FakeBackend backend = new FakeBackend();
    private final DataRangeService service =
            new DataRangeService(backend, new BackendCallExecutor(pool, new AlertService(clock), 200));

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void device_with_readings_reports_span_in_days() {
        backend.setRange(new DeviceDataRange(
                Instant.parse("2024-08-01T00:00:00Z"), Instant.parse("2024-08-15T06:00:00Z"), 12_345));

        DataRangeView v = service.dataRange("10.0.0.5");

        assertThat(v.hasData()).isTrue();
        assertThat(v.totalDays()).isEqualTo(15);
        assertThat(v.totalRecords()).isEqualTo(12_345);
        assertThat(v.earliestTimestamp()).isEqualTo(Instant.parse("2024-08-01T00:00:00Z"));
    }

    @Test
    void a_single_reading_counts_as_one_day() {
        Instant t = Instant.parse("2024-08-01T00:00:00Z");
        backend.setRange(new DeviceDataRange(t, t, 1));

        assertThat(service.dataRange("10.0.0.5").totalDays()).isEqualTo(1);
    }

    @Test
    void unknown_device_has_no_data() {
        DataRangeView v = service.dataRange("10.9.9.9");

        assertThat(v.hasData()).isFalse();
        assertThat(v.earliestTimestamp()).isNull();
        assertThat(v.latestTimestamp()).isNull();
        assertThat(v.totalDays()).isZero();
        assertThat(v.totalRecords()).isZero();
    }

    @Test
    void slow_probe_is_a_service_error() {
        backend.then(Mode.HANG);

        assertThatThrownBy(() -> service.dataRange("10.0.0.5"))
                .isInstanceOf(HistoryServiceException.class)
                .extracting("reason").isEqualTo(HistoryServiceException.Reason.QUERY_TIMEOUT_EXHAUSTED);
    }

    @Test
    void unreachable_store_is_a_service_error() {
        backend.then(Mode.FAIL);

        assertThatThrownBy(() -> service.dataRange("10.0.0.5"))
                .isInstanceOf(HistoryServiceException.class)
                .extracting("reason").isEqualTo(HistoryServiceException.Reason.BACKEND_UNAVAILABLE);
    }
}
