package com.elssolution.meterhistory.web;

import com.elssolution.meterhistory.alerts.AlertService;
import com.elssolution.meterhistory.service.cache.HistoryCache;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

    private final AlertService alerts;
    private final HistoryCache cache;

    public StatusController(AlertService alerts, HistoryCache cache) {
        this.alerts = alerts;
        this.cache = cache;
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }

    @GetMapping("/api/history/cache/stats")
    public HistoryCache.Stats cacheStats() {
        return cache.stats();
    }
}
