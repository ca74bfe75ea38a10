package com.delta.taskmonitor.monitor.persistence;

import com.delta.taskmonitor.config.MonitorProperties;
import com.delta.taskmonitor.monitor.model.ExecutionLogEntry;
import com.delta.taskmonitor.monitor.model.ExecutionStatus;
import com.delta.taskmonitor.monitor.model.ScheduledJob;
import com.delta.taskmonitor.monitor.util.RecipientParser;
import com.delta.taskmonitor.monitor.util.TimeStrings;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read-only access to the scheduler's task table and its execution log. The tables belong to the
 * scheduler; nothing here writes to them.
 */
@Repository
public class TaskJdbcRepository {
    static final int FLAG_YES = 2;
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final NamedParameterJdbcTemplate jdbc;
    private final RecipientParser recipientParser;
    private final String taskTable;
    private final String logTable;

    public TaskJdbcRepository(
        NamedParameterJdbcTemplate jdbc,
        RecipientParser recipientParser,
        MonitorProperties properties
    ) {
        this.jdbc = jdbc;
        this.recipientParser = recipientParser;
        String prefix = schemaPrefix(properties.getPersistence().getSchema());
        this.taskTable = prefix + "scheduled_task";
        this.logTable = prefix + "task_execution_log";
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public List<ScheduledJob> listActiveJobs() {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("active", FLAG_YES);
        return jdbc.query(
            "SELECT row_id, task_code, description, is_active, "
                + "monday, tuesday, wednesday, thursday, friday, saturday, sunday, "
                + "frequency, email_recipients, start_time "
                + "FROM " + taskTable + " "
                + "WHERE is_active = :active "
                + "ORDER BY row_id",
            params,
            jobRowMapper()
        );
    }

    public List<ExecutionLogEntry> listLogEntries(String taskCode) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskCode", taskCode);
        return jdbc.query(
            "SELECT task_code, status, end_date, user_message "
                + "FROM " + logTable + " "
                + "WHERE task_code = :taskCode "
                + "ORDER BY end_date DESC",
            params,
            (rs, rowNum) -> new ExecutionLogEntry(
                rs.getString("task_code"),
                ExecutionStatus.fromCode(rs.getInt("status")),
                toInstant(rs.getObject("end_date", LocalDateTime.class)),
                rs.getString("user_message")
            )
        );
    }

    public int countActiveJobs() {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM " + taskTable + " WHERE is_active = :active",
            new MapSqlParameterSource().addValue("active", FLAG_YES),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private RowMapper<ScheduledJob> jobRowMapper() {
        return (rs, rowNum) -> new ScheduledJob(
            rs.getLong("row_id"),
            rs.getString("task_code"),
            rs.getString("description"),
            rs.getInt("is_active") == FLAG_YES,
            activeWeekdays(rs),
            rs.getInt("frequency"),
            recipientParser.parse(rs.getString("email_recipients")),
            TimeStrings.parseTimeOfDay(rs.getString("start_time"))
        );
    }

    private Set<DayOfWeek> activeWeekdays(ResultSet rs) throws SQLException {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (rs.getInt(day.name().toLowerCase(Locale.ROOT)) == FLAG_YES) {
                days.add(day);
            }
        }
        return days;
    }

    private static String schemaPrefix(String schema) {
        if (schema == null) {
            return "";
        }
        if (!SAFE_IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid database schema name: " + schema);
        }
        return schema + ".";
    }

    // the scheduler stores UTC wall-clock values in zone-less datetime columns
    private static Instant toInstant(LocalDateTime utcDateTime) {
        return utcDateTime == null ? null : utcDateTime.toInstant(ZoneOffset.UTC);
    }
}
