package com.delta.taskmonitor.monitor.model;

public enum AlertKind {
    ERROR,
    LATE,
    STUCK_WAITING
}
