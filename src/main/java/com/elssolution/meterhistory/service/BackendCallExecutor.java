package com.elssolution.meterhistory.service;

import com.elssolution.meterhistory.alerts.AlertService;
import com.elssolution.meterhistory.integration.BackendUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs backend calls on the query pool with a per-call timeout.
 * On timeout the call is cancelled with interrupt; the caller decides whether to retry.
 * Outcomes feed the backend alerts.
 */
@Slf4j
@Component
public class BackendCallExecutor {

    private final ExecutorService pool;
    private final AlertService alerts;
    private final long timeoutMs;

    public BackendCallExecutor(@Qualifier("historyQueryExecutor") ExecutorService pool,
                               AlertService alerts,
                               @Value("${history.query.timeoutMs:10000}") long timeoutMs) {
        this.pool = pool;
        this.alerts = alerts;
        this.timeoutMs = timeoutMs;
    }

    /**
     * @throws TimeoutException          when the call did not finish within the timeout
     * @throws HistoryServiceException   (backend_unavailable) when the store cannot be reached;
     *                                   any other failure of the call is rethrown as is
     */
    public <T> T call(String op, Callable<T> task) throws TimeoutException {
        Future<T> f = pool.submit(task);
        try {
            T result = f.get(timeoutMs, TimeUnit.MILLISECONDS);
            alerts.resolve(AlertService.BACKEND_UNAVAILABLE);
            alerts.resolve(AlertService.BACKEND_TIMEOUT);
            return result;
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("backend_timeout op={} after {}ms", op, timeoutMs);
            alerts.raise(AlertService.BACKEND_TIMEOUT, op + " exceeded " + timeoutMs + " ms",
                    AlertService.Severity.WARN);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            if (cause instanceof BackendUnavailableException || cause instanceof DataAccessException) {
                alerts.raise(AlertService.BACKEND_UNAVAILABLE, op + ": " + cause.getMessage(),
                        AlertService.Severity.ERROR);
                throw new HistoryServiceException(HistoryServiceException.Reason.BACKEND_UNAVAILABLE,
                        "backend unavailable during " + op, cause);
            }
            // adapter bug, not an outage
            log.error("backend_call_failed op={}", op, cause);
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException(op + " failed", cause);
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            throw new HistoryServiceException(HistoryServiceException.Reason.BACKEND_UNAVAILABLE,
                    op + " interrupted", e);
        }
    }
}
