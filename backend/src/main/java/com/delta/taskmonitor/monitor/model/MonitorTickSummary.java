package com.delta.taskmonitor.monitor.model;

import java.time.Instant;

public record MonitorTickSummary(
    Instant startedAt,
    Instant finishedAt,
    int jobsChecked,
    int alertsRaised,
    int alertsSuppressed,
    int alertsSent,
    int deliveryFailures,
    int jobsSkipped
) {
    public static MonitorTickSummary empty(Instant startedAt, Instant finishedAt) {
        return new MonitorTickSummary(startedAt, finishedAt, 0, 0, 0, 0, 0, 0);
    }
}
