package com.delta.taskmonitor.monitor.model;

public enum ExecutionStatus {
    WAITING(1),
    SUCCESS(3),
    ERROR(7),
    UNKNOWN(-1);

    private final int code;

    ExecutionStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isFinished() {
        return this == SUCCESS || this == ERROR;
    }

    public static ExecutionStatus fromCode(int code) {
        for (ExecutionStatus status : values()) {
            if (status.code == code && status != UNKNOWN) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
