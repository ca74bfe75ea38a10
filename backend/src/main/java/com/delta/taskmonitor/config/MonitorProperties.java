package com.delta.taskmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {
    private static final String DEFAULT_FROM = "\"Task Monitor\" <monitor@example.com>";

    private boolean enabled = true;
    private Duration tickInterval = Duration.ofMinutes(5);
    private Duration initialDelay = Duration.ofSeconds(30);
    private Duration cooldown = Duration.ofMinutes(60);
    private Duration stuckWaitingTolerance = Duration.ofMinutes(5);
    private int jobConcurrency = 1;
    private Mail mail = new Mail();
    private Persistence persistence = new Persistence();
    private Cli cli = new Cli();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTickInterval() {
        return atLeast(tickInterval, Duration.ofSeconds(1));
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public void setCooldown(Duration cooldown) {
        this.cooldown = cooldown;
    }

    public Duration getStuckWaitingTolerance() {
        return stuckWaitingTolerance;
    }

    public void setStuckWaitingTolerance(Duration stuckWaitingTolerance) {
        this.stuckWaitingTolerance = stuckWaitingTolerance;
    }

    public int getJobConcurrency() {
        return Math.max(1, jobConcurrency);
    }

    public void setJobConcurrency(int jobConcurrency) {
        this.jobConcurrency = Math.max(1, jobConcurrency);
    }

    public Mail getMail() {
        return mail;
    }

    public void setMail(Mail mail) {
        this.mail = mail;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    private static Duration atLeast(Duration value, Duration floor) {
        if (value == null || value.compareTo(floor) < 0) {
            return floor;
        }
        return value;
    }

    public static class Mail {
        private String from;
        private String subjectPrefix = "Alert: ";
        private Duration sendTimeout = Duration.ofSeconds(30);
        private boolean html = true;

        public String getFrom() {
            if (from == null || from.isBlank()) {
                return DEFAULT_FROM;
            }
            return from.trim();
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getSubjectPrefix() {
            return subjectPrefix == null ? "" : subjectPrefix;
        }

        public void setSubjectPrefix(String subjectPrefix) {
            this.subjectPrefix = subjectPrefix;
        }

        public Duration getSendTimeout() {
            return atLeast(sendTimeout, Duration.ofSeconds(1));
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public boolean isHtml() {
            return html;
        }

        public void setHtml(boolean html) {
            this.html = html;
        }
    }

    public static class Persistence {
        private String schema;

        public String getSchema() {
            if (schema == null || schema.isBlank()) {
                return null;
            }
            return schema.trim();
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }
    }

    public static class Cli {
        private boolean runOnce = false;
        private boolean exitAfterRun = true;

        public boolean isRunOnce() {
            return runOnce;
        }

        public void setRunOnce(boolean runOnce) {
            this.runOnce = runOnce;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
