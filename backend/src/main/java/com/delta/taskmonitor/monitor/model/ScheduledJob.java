package com.delta.taskmonitor.monitor.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A row of the scheduled task table. The active and weekday flags are carried for callers but
 * the status evaluation does not look at them.
 */
public record ScheduledJob(
    long id,
    String taskCode,
    String description,
    boolean active,
    Set<DayOfWeek> activeWeekdays,
    int frequencyMinutes,
    List<String> emailRecipients,
    LocalTime startTime
) {
    public ScheduledJob {
        activeWeekdays = activeWeekdays == null ? Set.of() : Set.copyOf(activeWeekdays);
        emailRecipients = emailRecipients == null ? List.of() : List.copyOf(emailRecipients);
    }

    public boolean isActiveOn(DayOfWeek day) {
        return activeWeekdays.contains(day);
    }

    /**
     * ISO day numbers (Monday = 1 ... Sunday = 7) on which the task is flagged to run.
     */
    public List<Integer> activeDays() {
        List<Integer> days = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            if (activeWeekdays.contains(day)) {
                days.add(day.getValue());
            }
        }
        return days;
    }

    public Instant startTimeOn(LocalDate date, ZoneId zone) {
        if (startTime == null || date == null || zone == null) {
            return null;
        }
        return date.atTime(startTime).atZone(zone).toInstant();
    }
}
