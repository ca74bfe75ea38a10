package com.delta.taskmonitor.monitor.mail;

import java.util.List;

public interface AlertNotifier {

    /**
     * Sends one alert message. Throws {@link AlertDeliveryException} when the message could not
     * be handed to the mail server.
     */
    void send(List<String> to, String subject, String body);
}
