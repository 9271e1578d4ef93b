package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.domain.AggregationSpec;
import com.elssolution.meterhistory.domain.BackendResult;
import com.elssolution.meterhistory.domain.HistoryResponse;
import com.elssolution.meterhistory.domain.TimeWindow;
import com.elssolution.meterhistory.integration.MetricsBackend;
import com.elssolution.meterhistory.service.cache.CacheKey;
import com.elssolution.meterhistory.service.cache.CacheTtlPolicy;
import com.elssolution.meterhistory.service.cache.HistoryCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * History query pipeline: resolve window → pick interval → cache → backend → assemble.
 *
 * Failure handling:
 * - validation errors surface before any backend call
 * - a timed-out backend call is retried once with a doubled interval
 * - if the backend still fails, the last cached payload for the key is served flagged stale;
 *   without one the failure surfaces as {@link HistoryServiceException}
 */
@Slf4j
@Service
public class HistoryQueryService {

    private final TimeRangeResolver resolver;
    private final IntervalSelector intervals;
    private final HistoryCache cache;
    private final MetricsBackend backend;
    private final BackendCallExecutor calls;
    private final ResultAssembler assembler;

    public HistoryQueryService(TimeRangeResolver resolver,
                               IntervalSelector intervals,
                               HistoryCache cache,
                               MetricsBackend backend,
                               BackendCallExecutor calls,
                               ResultAssembler assembler) {
        this.resolver = resolver;
        this.intervals = intervals;
        this.cache = cache;
        this.backend = backend;
        this.calls = calls;
        this.assembler = assembler;
    }

    public HistoryResponse history(String deviceId, String startTime, String endTime,
                                   String timePeriod, String interval) {
        TimeWindow window = resolver.resolve(startTime, endTime, timePeriod);
        Duration override = Intervals.parse(interval, resolver.maxRange());
        AggregationSpec spec = intervals.select(window, override);
        CacheKey key = CacheKey.of(deviceId, window, spec, backend.id());
        Duration ttl = CacheTtlPolicy.ttlFor(window.period());

        try {
            return cache.getOrCompute(key, ttl, () -> compute(deviceId, window, spec));
        } catch (HistoryServiceException e) {
            Optional<HistoryResponse> stale = cache.lastKnown(key);
            if (stale.isPresent()) {
                log.warn("history_stale_served device={} period={} reason={}",
                        deviceId, window.period().key(), e.getReason().code());
                return stale.get().asStale();
            }
            log.error("history_failed device={} period={} reason={}: {}",
                    deviceId, window.period().key(), e.getReason().code(), e.getMessage());
            throw e;
        }
    }

    private HistoryResponse compute(String deviceId, TimeWindow window, AggregationSpec spec) {
        AggregationSpec effective = spec;
        BackendResult result;
        try {
            result = query(deviceId, window, effective);
        } catch (TimeoutException first) {
            effective = spec.widened();
            log.warn("history_retry_widened device={} interval={} → {}",
                    deviceId, Intervals.format(spec.interval()), Intervals.format(effective.interval()));
            try {
                result = query(deviceId, window, effective);
            } catch (TimeoutException second) {
                throw new HistoryServiceException(HistoryServiceException.Reason.QUERY_TIMEOUT_EXHAUSTED,
                        "backend timed out twice for device " + deviceId, second);
            }
        }
        return assembler.assemble(deviceId, window, effective, backend.id(), result);
    }

    private BackendResult query(String deviceId, TimeWindow window, AggregationSpec spec) throws TimeoutException {
        return calls.call("history " + backend.id(),
                () -> backend.query(deviceId, window, spec.interval()));
    }
}
