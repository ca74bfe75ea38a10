package com.delta.taskmonitor.monitor.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TimeStrings {
    private static final Logger log = LoggerFactory.getLogger(TimeStrings.class);
    private static final Pattern WEEKS_OR_YEARS = Pattern.compile("^(\\d+)([wy])$");

    private TimeStrings() {
    }

    /**
     * Parses a duration such as {@code 15m}, {@code 7d} or {@code PT10M} with Spring Boot's
     * duration styles, plus the {@code w} (7 days) and {@code y} (365 days) units.
     */
    public static Duration parseDuration(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Duration string is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = WEEKS_OR_YEARS.matcher(normalized);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return "w".equals(matcher.group(2)) ? Duration.ofDays(amount * 7) : Duration.ofDays(amount * 365);
        }
        try {
            return DurationStyle.detectAndParse(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid time string format: " + value + ". Expected format like \"15m\", \"7d\", \"3600s\".",
                e
            );
        }
    }

    /**
     * Parses an {@code HH:mm[:ss]} time of day. Missing or non-numeric parts count as zero;
     * out-of-range values give {@code null}.
     */
    public static LocalTime parseTimeOfDay(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.trim().split(":");
        try {
            return LocalTime.of(partOrZero(parts, 0), partOrZero(parts, 1), partOrZero(parts, 2));
        } catch (DateTimeException e) {
            log.warn("Ignoring out-of-range time of day '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static int partOrZero(String[] parts, int index) {
        if (index >= parts.length) {
            return 0;
        }
        try {
            return Integer.parseInt(parts[index].trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
