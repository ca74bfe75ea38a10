package com.delta.taskmonitor.monitor.model;

import java.time.Instant;

/**
 * One row of a task's execution history. For {@link ExecutionStatus#WAITING} rows the end
 * timestamp holds the scheduled run time.
 */
public record ExecutionLogEntry(
    String taskCode,
    ExecutionStatus status,
    Instant endDate,
    String userMessage
) {
}
