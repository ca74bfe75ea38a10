package com.delta.taskmonitor.monitor.service;

import com.delta.taskmonitor.config.MonitorProperties;
import com.delta.taskmonitor.monitor.model.AlertKind;
import com.delta.taskmonitor.monitor.model.ExecutionLogEntry;
import com.delta.taskmonitor.monitor.model.ExecutionStatus;
import com.delta.taskmonitor.monitor.model.JobAlert;
import com.delta.taskmonitor.monitor.model.ScheduledJob;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusEvaluatorTest {
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private final JobStatusEvaluator evaluator = new JobStatusEvaluator(new MonitorProperties());

    @Test
    void noLogEntriesMeansNoAlert() {
        assertThat(evaluator.evaluate(job(30), List.of(), NOW)).isEmpty();
        assertThat(evaluator.evaluate(job(30), null, NOW)).isEmpty();
    }

    @Test
    void lateSuccessRaisesLateAlert() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(30),
            List.of(entry(ExecutionStatus.SUCCESS, 45, null)),
            NOW
        );

        assertThat(alert).isPresent();
        assertThat(alert.get().kind()).isEqualTo(AlertKind.LATE);
        assertThat(alert.get().reason())
            .contains("LATE")
            .contains("2026-03-02T11:15:00.000Z")
            .contains("30 min interval");
    }

    @Test
    void recentSuccessRaisesNothing() {
        assertThat(evaluator.evaluate(job(30), List.of(entry(ExecutionStatus.SUCCESS, 10, null)), NOW))
            .isEmpty();
    }

    @Test
    void successExactlyAtFrequencyIsNotLate() {
        assertThat(evaluator.evaluate(job(30), List.of(entry(ExecutionStatus.SUCCESS, 30, null)), NOW))
            .isEmpty();
        assertThat(evaluator.evaluate(job(30), List.of(entryAt(ExecutionStatus.SUCCESS, NOW.minusSeconds(30 * 60 + 1), null)), NOW))
            .isPresent();
    }

    @Test
    void errorRaisesAlertWithMessage() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(30),
            List.of(entry(ExecutionStatus.ERROR, 5, "disk full")),
            NOW
        );

        assertThat(alert).isPresent();
        assertThat(alert.get().kind()).isEqualTo(AlertKind.ERROR);
        assertThat(alert.get().reason())
            .contains("ERROR")
            .contains("disk full")
            .contains("Task Nightly export");
    }

    @Test
    void errorWithoutMessageReportsNotAvailable() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(30),
            List.of(entry(ExecutionStatus.ERROR, 5, null)),
            NOW
        );
        assertThat(alert).isPresent();
        assertThat(alert.get().reason()).endsWith("Message: N/A");
        assertThat(evaluator.evaluate(job(30), List.of(entry(ExecutionStatus.ERROR, 5, "")), NOW))
            .map(JobAlert::reason)
            .hasValueSatisfying(reason -> assertThat(reason).endsWith("Message: N/A"));
    }

    @Test
    void whitespaceMessageIsReportedAsIs() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(30),
            List.of(entry(ExecutionStatus.ERROR, 5, " ")),
            NOW
        );
        assertThat(alert).isPresent();
        assertThat(alert.get().reason()).endsWith("Message:  ");
    }

    @Test
    void timestampsAlwaysCarryMilliseconds() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(30),
            List.of(entryAt(ExecutionStatus.ERROR, Instant.parse("2026-03-02T11:55:00.250Z"), "x")),
            NOW
        );
        assertThat(alert.get().reason()).contains("at 2026-03-02T11:55:00.250Z.");
    }

    @Test
    void errorWinsRegardlessOfOlderSuccessesAndStuckWaiting() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(600),
            List.of(
                entry(ExecutionStatus.WAITING, 60, null),
                entry(ExecutionStatus.SUCCESS, 120, null),
                entry(ExecutionStatus.ERROR, 20, "timeout")
            ),
            NOW
        );
        assertThat(alert).map(JobAlert::kind).contains(AlertKind.ERROR);
    }

    @Test
    void newerSuccessHidesOlderError() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(30),
            List.of(
                entry(ExecutionStatus.ERROR, 25, "boom"),
                entry(ExecutionStatus.SUCCESS, 5, null)
            ),
            NOW
        );
        assertThat(alert).isEmpty();
    }

    @Test
    void lateSuccessTakesPrecedenceOverStuckWaiting() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(30),
            List.of(
                entry(ExecutionStatus.SUCCESS, 45, null),
                entry(ExecutionStatus.WAITING, 20, null)
            ),
            NOW
        );
        assertThat(alert).map(JobAlert::kind).contains(AlertKind.LATE);
    }

    @Test
    void waitingOverdueBeyondToleranceIsStuck() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(30),
            List.of(entry(ExecutionStatus.WAITING, 10, null)),
            NOW
        );

        assertThat(alert).isPresent();
        assertThat(alert.get().kind()).isEqualTo(AlertKind.STUCK_WAITING);
        assertThat(alert.get().reason())
            .contains("STUCK")
            .contains("Scheduled for 2026-03-02T11:50:00.000Z");
    }

    @Test
    void waitingWithinToleranceOrInFutureIsFine() {
        assertThat(evaluator.evaluate(job(30), List.of(entry(ExecutionStatus.WAITING, 3, null)), NOW)).isEmpty();
        assertThat(evaluator.evaluate(job(30), List.of(entry(ExecutionStatus.WAITING, 5, null)), NOW)).isEmpty();
        assertThat(evaluator.evaluate(job(30), List.of(entryAt(ExecutionStatus.WAITING, NOW.plusSeconds(600), null)), NOW))
            .isEmpty();
    }

    @Test
    void stuckCheckRunsWhenLastSuccessIsOnTime() {
        Optional<JobAlert> alert = evaluator.evaluate(
            job(60),
            List.of(
                entry(ExecutionStatus.SUCCESS, 20, null),
                entry(ExecutionStatus.WAITING, 15, null)
            ),
            NOW
        );
        assertThat(alert).map(JobAlert::kind).contains(AlertKind.STUCK_WAITING);
    }

    @Test
    void stuckToleranceIsConfigurable() {
        MonitorProperties properties = new MonitorProperties();
        properties.setStuckWaitingTolerance(Duration.ofMinutes(15));
        JobStatusEvaluator lenient = new JobStatusEvaluator(properties);

        assertThat(lenient.evaluate(job(30), List.of(entry(ExecutionStatus.WAITING, 10, null)), NOW)).isEmpty();
        assertThat(lenient.evaluate(job(30), List.of(entry(ExecutionStatus.WAITING, 16, null)), NOW)).isPresent();
    }

    @Test
    void unknownStatusesAreIgnored() {
        assertThat(evaluator.evaluate(job(30), List.of(entry(ExecutionStatus.UNKNOWN, 600, "running")), NOW))
            .isEmpty();
    }

    @Test
    void inactiveWeekdayDoesNotSilenceAlerts() {
        ScheduledJob weekendOnly = new ScheduledJob(
            9L, "T9", "Weekend sync", true, Set.of(DayOfWeek.SATURDAY), 30, List.of("ops@example.com"), null
        );
        // NOW is a Monday
        assertThat(evaluator.evaluate(weekendOnly, List.of(entry(ExecutionStatus.ERROR, 5, "x")), NOW)).isPresent();
    }

    @Test
    void malformedRecordsAreRejected() {
        assertThatThrownBy(() -> evaluator.evaluate(job(0), List.of(), NOW))
            .isInstanceOf(InvalidJobRecordException.class)
            .hasMessageContaining("frequency");
        assertThatThrownBy(() -> evaluator.evaluate(
            job(30),
            List.of(new ExecutionLogEntry("T1", ExecutionStatus.SUCCESS, null, null)),
            NOW
        )).isInstanceOf(InvalidJobRecordException.class);
        assertThatThrownBy(() -> evaluator.evaluate(
            new ScheduledJob(2L, "T2", " ", true, null, 30, null, null),
            List.of(),
            NOW
        )).isInstanceOf(InvalidJobRecordException.class);
    }

    private static ScheduledJob job(int frequencyMinutes) {
        return new ScheduledJob(
            1L, "T1", "Nightly export", true, Set.of(), frequencyMinutes, List.of("ops@example.com"), null
        );
    }

    private static ExecutionLogEntry entry(ExecutionStatus status, long minutesAgo, String message) {
        return entryAt(status, NOW.minusSeconds(minutesAgo * 60), message);
    }

    private static ExecutionLogEntry entryAt(ExecutionStatus status, Instant endDate, String message) {
        return new ExecutionLogEntry("T1", status, endDate, message);
    }
}
