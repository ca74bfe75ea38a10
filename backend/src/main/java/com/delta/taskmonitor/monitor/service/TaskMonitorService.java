package com.delta.taskmonitor.monitor.service;

import com.delta.taskmonitor.config.MonitorProperties;
import com.delta.taskmonitor.monitor.mail.AlertDeliveryException;
import com.delta.taskmonitor.monitor.mail.AlertNotifier;
import com.delta.taskmonitor.monitor.model.ExecutionLogEntry;
import com.delta.taskmonitor.monitor.model.JobAlert;
import com.delta.taskmonitor.monitor.model.MonitorStatus;
import com.delta.taskmonitor.monitor.model.MonitorTickSummary;
import com.delta.taskmonitor.monitor.model.ScheduledJob;
import com.delta.taskmonitor.monitor.persistence.TaskJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class TaskMonitorService {
    private static final Logger log = LoggerFactory.getLogger(TaskMonitorService.class);

    private final TaskJdbcRepository repository;
    private final JobStatusEvaluator evaluator;
    private final AlertCooldownTracker cooldownTracker;
    private final AlertNotifier notifier;
    private final MonitorProperties properties;
    private final Clock clock;
    private final ExecutorService jobCheckExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;
    private volatile MonitorTickSummary lastTick;

    public TaskMonitorService(
        TaskJdbcRepository repository,
        JobStatusEvaluator evaluator,
        AlertCooldownTracker cooldownTracker,
        AlertNotifier notifier,
        MonitorProperties properties,
        Clock clock,
        @Qualifier("jobCheckExecutor") ExecutorService jobCheckExecutor
    ) {
        this.repository = repository;
        this.evaluator = evaluator;
        this.cooldownTracker = cooldownTracker;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
        this.jobCheckExecutor = jobCheckExecutor;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.isEnabled() && !properties.getCli().isRunOnce()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public MonitorStatus getStatus() {
        return new MonitorStatus(running.get(), tickInProgress.get(), cooldownTracker.trackedCount(), lastTick);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            Duration interval = properties.getTickInterval();
            Duration initialDelay = properties.getInitialDelay();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("task-monitor-ticker");
                thread.setDaemon(true);
                return thread;
            });
            // fixed delay: the next tick is scheduled only after the previous one returns
            scheduler.scheduleWithFixedDelay(
                this::scheduledTick,
                initialDelay.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
            );
            running.set(true);
            log.info("Task monitor started: interval={} cooldown={}", interval, cooldownTracker.getCooldown());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (scheduler != null) {
                scheduler.shutdownNow();
                try {
                    scheduler.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                scheduler = null;
            }
            log.info("Task monitor stopped");
        }
    }

    public MonitorTickSummary runTick() {
        Instant now = clock.instant();
        if (!tickInProgress.compareAndSet(false, true)) {
            log.warn("Skipping monitoring check at {} because the previous check is still running", now);
            return MonitorTickSummary.empty(now, now);
        }
        try {
            MonitorTickSummary summary = checkAllJobs(now);
            lastTick = summary;
            log.info(
                "Monitoring check done: jobs={}, alerts={}, suppressed={}, sent={}, deliveryFailures={}, skipped={}",
                summary.jobsChecked(),
                summary.alertsRaised(),
                summary.alertsSuppressed(),
                summary.alertsSent(),
                summary.deliveryFailures(),
                summary.jobsSkipped()
            );
            return summary;
        } finally {
            tickInProgress.set(false);
        }
    }

    private void scheduledTick() {
        try {
            runTick();
        } catch (Exception e) {
            // an exception escaping here would cancel every later tick
            log.warn("Monitoring check failed unexpectedly", e);
        }
    }

    private MonitorTickSummary checkAllJobs(Instant now) {
        log.info("Running monitoring check...");
        List<ScheduledJob> jobs;
        try {
            jobs = repository.listActiveJobs();
        } catch (DataAccessException e) {
            log.warn("Failed to load active tasks, skipping this monitoring check", e);
            return MonitorTickSummary.empty(now, clock.instant());
        }

        TickCounters counters = new TickCounters();
        if (properties.getJobConcurrency() <= 1) {
            for (ScheduledJob job : jobs) {
                checkJob(job, now, counters);
            }
        } else {
            List<Future<?>> futures = new ArrayList<>(jobs.size());
            for (ScheduledJob job : jobs) {
                futures.add(jobCheckExecutor.submit(() -> checkJob(job, now, counters)));
            }
            awaitAll(futures, counters);
        }
        return counters.toSummary(now, clock.instant());
    }

    private void checkJob(ScheduledJob job, Instant now, TickCounters counters) {
        try {
            evaluator.validate(job);
            List<ExecutionLogEntry> entries = repository.listLogEntries(job.taskCode());
            Optional<JobAlert> alert = evaluator.evaluate(job, entries, now);
            counters.jobsChecked.incrementAndGet();
            alert.ifPresent(value -> sendAlert(job, value, now, counters));
        } catch (InvalidJobRecordException e) {
            counters.jobsSkipped.incrementAndGet();
            log.warn("Skipping task {} in this check: {}", job == null ? null : job.id(), e.getMessage());
        } catch (DataAccessException e) {
            counters.jobsSkipped.incrementAndGet();
            log.warn("Failed to load execution log for task {}", job.taskCode(), e);
        } catch (RuntimeException e) {
            counters.jobsSkipped.incrementAndGet();
            log.warn("Unexpected failure while checking task {}", job == null ? null : job.id(), e);
        }
    }

    private void sendAlert(ScheduledJob job, JobAlert alert, Instant now, TickCounters counters) {
        counters.alertsRaised.incrementAndGet();
        if (!cooldownTracker.tryBeginAlert(job.id(), now)) {
            counters.alertsSuppressed.incrementAndGet();
            log.info("Alert for task {} is on cooldown. Reason: {}", job.description(), alert.reason());
            return;
        }

        log.warn("ALERT for {}: {}", job.description(), alert.reason());
        boolean delivered = false;
        try {
            notifier.send(job.emailRecipients(), subjectFor(job), alert.reason());
            cooldownTracker.recordAlertSent(job.id(), now);
            delivered = true;
            counters.alertsSent.incrementAndGet();
        } catch (AlertDeliveryException e) {
            counters.deliveryFailures.incrementAndGet();
            log.error("Failed to send alert email for {}", job.description(), e);
        } catch (RuntimeException e) {
            counters.deliveryFailures.incrementAndGet();
            log.error("Unexpected error sending alert email for {}", job.description(), e);
        } finally {
            if (!delivered) {
                cooldownTracker.abandonAlert(job.id());
            }
        }
    }

    private String subjectFor(ScheduledJob job) {
        return properties.getMail().getSubjectPrefix() + "Task " + job.description() + " requires attention";
    }

    private void awaitAll(List<Future<?>> futures, TickCounters counters) {
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                counters.jobsSkipped.incrementAndGet();
                log.warn("Task check failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                int cancelled = cancelRemaining(futures.subList(i, futures.size()));
                log.warn("Interrupted while waiting for task checks to finish, cancelled {} checks", cancelled);
                return;
            }
        }
    }

    private int cancelRemaining(List<Future<?>> remaining) {
        int cancelled = 0;
        for (Future<?> future : remaining) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    private static final class TickCounters {
        private final AtomicInteger jobsChecked = new AtomicInteger();
        private final AtomicInteger alertsRaised = new AtomicInteger();
        private final AtomicInteger alertsSuppressed = new AtomicInteger();
        private final AtomicInteger alertsSent = new AtomicInteger();
        private final AtomicInteger deliveryFailures = new AtomicInteger();
        private final AtomicInteger jobsSkipped = new AtomicInteger();

        private MonitorTickSummary toSummary(Instant startedAt, Instant finishedAt) {
            return new MonitorTickSummary(
                startedAt,
                finishedAt,
                jobsChecked.get(),
                alertsRaised.get(),
                alertsSuppressed.get(),
                alertsSent.get(),
                deliveryFailures.get(),
                jobsSkipped.get()
            );
        }
    }
}
