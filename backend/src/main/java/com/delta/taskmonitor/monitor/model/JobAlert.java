package com.delta.taskmonitor.monitor.model;

public record JobAlert(
    AlertKind kind,
    String reason
) {
}
