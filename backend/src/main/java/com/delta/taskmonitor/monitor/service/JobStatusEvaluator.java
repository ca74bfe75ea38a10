package com.delta.taskmonitor.monitor.service;

import com.delta.taskmonitor.config.MonitorProperties;
import com.delta.taskmonitor.monitor.model.AlertKind;
import com.delta.taskmonitor.monitor.model.ExecutionLogEntry;
import com.delta.taskmonitor.monitor.model.ExecutionStatus;
import com.delta.taskmonitor.monitor.model.JobAlert;
import com.delta.taskmonitor.monitor.model.ScheduledJob;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a task needs an alert, based only on its execution log and the current time.
 * <p>
 * Checks run in order and the first match wins: the last finished run ended in ERROR, the last
 * successful run is older than the task frequency, and finally a WAITING entry whose scheduled
 * time passed more than the stuck tolerance ago. A task without log entries never alerts.
 * The active and weekday flags of the task are not consulted.
 */
@Component
public class JobStatusEvaluator {
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Duration stuckWaitingTolerance;

    public JobStatusEvaluator(MonitorProperties properties) {
        this.stuckWaitingTolerance = properties.getStuckWaitingTolerance();
    }

    public Optional<JobAlert> evaluate(ScheduledJob job, List<ExecutionLogEntry> entries, Instant now) {
        validate(job);
        if (now == null) {
            throw new IllegalArgumentException("now is required");
        }
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        List<ExecutionLogEntry> newestFirst = newestFirst(entries);

        Optional<JobAlert> lastRunAlert = newestFirst.stream()
            .filter(entry -> entry.status().isFinished())
            .findFirst()
            .flatMap(entry -> checkLastRun(job, entry, now));
        if (lastRunAlert.isPresent()) {
            return lastRunAlert;
        }

        return newestFirst.stream()
            .filter(entry -> entry.status() == ExecutionStatus.WAITING)
            .findFirst()
            .flatMap(entry -> checkWaiting(job, entry, now));
    }

    public void validate(ScheduledJob job) {
        if (job == null) {
            throw new InvalidJobRecordException("Task record is missing");
        }
        if (job.taskCode() == null || job.taskCode().isBlank()) {
            throw new InvalidJobRecordException("Task " + job.id() + " has no task code");
        }
        if (job.description() == null || job.description().isBlank()) {
            throw new InvalidJobRecordException("Task " + job.id() + " has no description");
        }
        if (job.active() && job.frequencyMinutes() <= 0) {
            throw new InvalidJobRecordException(
                "Task " + job.id() + " is active but has frequency " + job.frequencyMinutes()
            );
        }
    }

    private Optional<JobAlert> checkLastRun(ScheduledJob job, ExecutionLogEntry entry, Instant now) {
        if (entry.status() == ExecutionStatus.ERROR) {
            String message = entry.userMessage() == null || entry.userMessage().isEmpty()
                ? "N/A"
                : entry.userMessage();
            return Optional.of(new JobAlert(
                AlertKind.ERROR,
                "Task " + job.description() + " last execution resulted in an ERROR at "
                    + format(entry.endDate()) + ". Message: " + message
            ));
        }
        Duration sinceSuccess = Duration.between(entry.endDate(), now);
        if (sinceSuccess.compareTo(Duration.ofMinutes(job.frequencyMinutes())) > 0) {
            return Optional.of(new JobAlert(
                AlertKind.LATE,
                "Task " + job.description() + " is LATE. Last successful execution was at "
                    + format(entry.endDate()) + ", which is more than the " + job.frequencyMinutes()
                    + " min interval."
            ));
        }
        return Optional.empty();
    }

    private Optional<JobAlert> checkWaiting(ScheduledJob job, ExecutionLogEntry entry, Instant now) {
        if (!entry.endDate().isBefore(now)) {
            return Optional.empty();
        }
        Duration overdue = Duration.between(entry.endDate(), now);
        if (overdue.compareTo(stuckWaitingTolerance) <= 0) {
            return Optional.empty();
        }
        return Optional.of(new JobAlert(
            AlertKind.STUCK_WAITING,
            "Task " + job.description() + " is STUCK in WAITING state. Scheduled for "
                + format(entry.endDate()) + " but not processed."
        ));
    }

    private static String format(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    private List<ExecutionLogEntry> newestFirst(List<ExecutionLogEntry> entries) {
        List<ExecutionLogEntry> sorted = new ArrayList<>(entries.size());
        for (ExecutionLogEntry entry : entries) {
            if (entry == null || entry.status() == null || entry.endDate() == null) {
                throw new InvalidJobRecordException("Execution log entry is missing its status or end date");
            }
            sorted.add(entry);
        }
        sorted.sort(Comparator.comparing(ExecutionLogEntry::endDate).reversed());
        return sorted;
    }
}
