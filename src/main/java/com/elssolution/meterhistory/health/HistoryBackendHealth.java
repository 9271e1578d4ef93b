package com.elssolution.meterhistory.health;

import com.elssolution.meterhistory.alerts.AlertService;
import com.elssolution.meterhistory.integration.MetricsBackend;
import com.elssolution.meterhistory.service.cache.HistoryCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class HistoryBackendHealth implements HealthIndicator {

    private final MetricsBackend backend;
    private final AlertService alerts;
    private final HistoryCache cache;

    public HistoryBackendHealth(MetricsBackend backend, AlertService alerts, HistoryCache cache) {
        this.backend = backend;
        this.alerts = alerts;
        this.cache = cache;
    }

    @Override public Health health() {
        boolean down = alerts.isActive(AlertService.BACKEND_UNAVAILABLE);
        boolean slow = alerts.isActive(AlertService.BACKEND_TIMEOUT);
        HistoryCache.Stats stats = cache.stats();

        return (down ? Health.down() : Health.up())
                .withDetail("backend", backend.id())
                .withDetail("timeouts", slow)
                .withDetail("cacheEntries", stats.size())
                .withDetail("cacheHitRate", stats.hitRate())
                .build();
    }
}
