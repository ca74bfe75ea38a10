package com.delta.taskmonitor.monitor.service;

import com.delta.taskmonitor.config.MonitorProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Remembers when the last alert went out for each task so repeated failures do not flood the
 * recipients. State lives in memory only and is lost on restart.
 */
@Component
public class AlertCooldownTracker {
    private final Duration cooldown;
    private final Map<Long, Instant> lastAlertTimes = new HashMap<>();
    private final Set<Long> inFlight = new HashSet<>();

    public AlertCooldownTracker(MonitorProperties properties) {
        this.cooldown = properties.getCooldown();
    }

    public synchronized boolean shouldSuppress(long jobId, Instant now) {
        Instant lastAlert = lastAlertTimes.get(jobId);
        return lastAlert != null && Duration.between(lastAlert, now).compareTo(cooldown) < 0;
    }

    public synchronized void recordAlertSent(long jobId, Instant now) {
        lastAlertTimes.put(jobId, now);
        inFlight.remove(jobId);
    }

    /**
     * Reserves the right to send an alert for the task. Returns false when the task is on
     * cooldown or another alert for it is being sent. A successful reservation must end with
     * {@link #recordAlertSent} or {@link #abandonAlert}.
     */
    public synchronized boolean tryBeginAlert(long jobId, Instant now) {
        if (inFlight.contains(jobId) || shouldSuppress(jobId, now)) {
            return false;
        }
        inFlight.add(jobId);
        return true;
    }

    public synchronized void abandonAlert(long jobId) {
        inFlight.remove(jobId);
    }

    public synchronized Instant lastAlertAt(long jobId) {
        return lastAlertTimes.get(jobId);
    }

    public synchronized int trackedCount() {
        return lastAlertTimes.size();
    }

    public Duration getCooldown() {
        return cooldown;
    }
}
