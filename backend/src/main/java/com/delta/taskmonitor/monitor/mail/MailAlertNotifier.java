package com.delta.taskmonitor.monitor.mail;

import com.delta.taskmonitor.config.MonitorProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.jsoup.nodes.Entities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class MailAlertNotifier implements AlertNotifier {
    private static final Logger log = LoggerFactory.getLogger(MailAlertNotifier.class);

    private final JavaMailSender mailSender;
    private final MonitorProperties properties;
    private final ExecutorService mailExecutor;

    public MailAlertNotifier(
        JavaMailSender mailSender,
        MonitorProperties properties,
        @Qualifier("mailExecutor") ExecutorService mailExecutor
    ) {
        this.mailSender = mailSender;
        this.properties = properties;
        this.mailExecutor = mailExecutor;
    }

    @Override
    public void send(List<String> to, String subject, String body) {
        if (to == null || to.isEmpty()) {
            throw new AlertDeliveryException("No recipients configured for alert: " + subject);
        }
        Duration timeout = properties.getMail().getSendTimeout();
        Future<?> delivery = mailExecutor.submit(() -> {
            deliver(to, subject, body);
            return null;
        });
        try {
            delivery.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Alert email sent: to={} subject={}", to, subject);
        } catch (TimeoutException e) {
            delivery.cancel(true);
            throw new AlertDeliveryException("Timed out after " + timeout + " sending alert to " + to, e);
        } catch (ExecutionException e) {
            throw new AlertDeliveryException("Failed to send alert to " + to, e.getCause());
        } catch (InterruptedException e) {
            delivery.cancel(true);
            Thread.currentThread().interrupt();
            throw new AlertDeliveryException("Interrupted while sending alert to " + to, e);
        }
    }

    private void deliver(List<String> to, String subject, String body) throws MessagingException {
        boolean html = properties.getMail().isHtml();
        MimeMessage message = mailSender.createMimeMessage();
        MimeMessageHelper helper = new MimeMessageHelper(message, html, "UTF-8");
        helper.setFrom(properties.getMail().getFrom());
        helper.setTo(to.toArray(new String[0]));
        helper.setSubject(subject);
        if (html) {
            helper.setText(body, formatHtmlContent(subject, body));
        } else {
            helper.setText(body);
        }
        mailSender.send(message);
    }

    static String formatHtmlContent(String title, String content) {
        String escapedContent = Entities.escape(content == null ? "" : content).replace("\n", "<br>");
        return "<html><body style=\"font-family: sans-serif;\">"
            + "<h3 style=\"color: #c0392b;\">" + Entities.escape(title == null ? "" : title) + "</h3>"
            + "<p>" + escapedContent + "</p>"
            + "</body></html>";
    }
}
