package com.delta.taskmonitor.monitor.service;

public class InvalidJobRecordException extends RuntimeException {
    public InvalidJobRecordException(String message) {
        super(message);
    }
}
