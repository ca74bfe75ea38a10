package com.delta.taskmonitor.monitor.mail;

public class AlertDeliveryException extends RuntimeException {
    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
