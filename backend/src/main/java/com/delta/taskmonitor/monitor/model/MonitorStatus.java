package com.delta.taskmonitor.monitor.model;

public record MonitorStatus(
    boolean running,
    boolean tickInProgress,
    int trackedAlerts,
    MonitorTickSummary lastTick
) {
}
