package com.elssolution.meterhistory.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keyed alert episodes for the read backends (BACKEND_UNAVAILABLE, BACKEND_TIMEOUT).
 * raise() opens or refreshes an episode, resolve() closes it; both land in a short event log.
 */
@Slf4j
@Service
public class AlertService {

    public static final String BACKEND_UNAVAILABLE = "BACKEND_UNAVAILABLE";
    public static final String BACKEND_TIMEOUT = "BACKEND_TIMEOUT";

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms, start of the current episode
        long lastSeen;
        int count;        // raise() calls in this episode
        boolean active;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;
        String type;      // RAISE | RESOLVE
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent; // newest first
    }

    private final Clock clock;
    private final Map<String, MutableAlert> alerts = new ConcurrentHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>();
    private final int recentCapacity = 50;

    public AlertService(Clock clock) {
        this.clock = clock;
    }

    public void raise(String key, String message, Severity sev) {
        long now = clock.millis();
        MutableAlert a = alerts.computeIfAbsent(key, k -> new MutableAlert(k, now));

        boolean newEpisode;
        synchronized (a) {
            newEpisode = !a.active;
            if (newEpisode) {
                a.firstSeen = now;
                a.count.set(0);
            }
            a.active = true;
            a.severity = sev;
            a.message = message;
            a.count.incrementAndGet();
            a.lastSeen = now;
        }

        if (newEpisode) {
            log.warn("ALERT RAISE key={} sev={} msg={}", key, sev, message);
        } else if (log.isDebugEnabled()) {
            log.debug("alert_refresh key={} count={}", key, a.count.get());
        }
        emitEvent(key, message, sev, "RAISE");
    }

    public void resolve(String key) {
        MutableAlert a = alerts.get(key);
        if (a == null) return;

        boolean wasActive;
        Severity sev;
        synchronized (a) {
            wasActive = a.active;
            sev = a.severity;
            a.active = false;
            a.lastSeen = clock.millis();
        }
        if (wasActive) {
            log.info("ALERT RESOLVE key={}", key);
            emitEvent(key, "recovered", sev, "RESOLVE");
        }
    }

    public boolean isActive(String key) {
        MutableAlert a = alerts.get(key);
        return a != null && a.active;
    }

    public AlertsSnapshot snapshot() {
        List<AlertView> active = alerts.values().stream()
                .filter(ma -> ma.active)
                .sorted(Comparator.comparingLong((MutableAlert ma) -> ma.lastSeen).reversed())
                .map(MutableAlert::view)
                .toList();

        List<EventView> recentCopy;
        synchronized (recent) {
            recentCopy = new ArrayList<>(recent);
        }
        Collections.reverse(recentCopy);
        return AlertsSnapshot.builder().active(active).recent(recentCopy).build();
    }

    private void emitEvent(String key, String msg, Severity sev, String type) {
        EventView ev = EventView.builder()
                .key(key).message(msg).severity(sev).type(type)
                .ts(clock.millis())
                .build();
        synchronized (recent) {
            recent.addLast(ev);
            while (recent.size() > recentCapacity) recent.removeFirst();
        }
    }

    private static class MutableAlert {
        final String key;
        volatile String message;
        volatile Severity severity = Severity.INFO;
        volatile boolean active;
        volatile long firstSeen;
        volatile long lastSeen;
        final AtomicInteger count = new AtomicInteger(0);

        MutableAlert(String key, long now) {
            this.key = key;
            this.firstSeen = now;
            this.lastSeen = now;
        }

        AlertView view() {
            return AlertView.builder()
                    .key(key).message(message).severity(severity).active(active)
                    .firstSeen(firstSeen).lastSeen(lastSeen).count(count.get())
                    .build();
        }
    }
}
