package com.safee.jobs.store;

import com.safee.jobs.db.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.safee.jobs.db.Jdbc.bind;
import static com.safee.jobs.db.Jdbc.getInstant;
import static com.safee.jobs.db.Jdbc.getUuid;
import static com.safee.jobs.db.Jdbc.instantOrNull;
import static com.safee.jobs.db.Jdbc.rollbackQuietly;
import static com.safee.jobs.db.Jdbc.setInstant;
import static com.safee.jobs.db.Jdbc.setText;
import static com.safee.jobs.db.Jdbc.textOrNull;

/**
 * Persistence for recurring job schedules. (name, jobName) is unique.
 */
public class ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

    private static final String COLUMNS = "id, name, description, job_name, cron_expression, time_zone, is_active, "
            + "payload, priority, organization_id, last_run_at, next_run_at, created_at, updated_at";
    private static final String UNIQUE_VIOLATION = "23505";

    private final DataSource dataSource;
    private final Clock clock;

    public ScheduleStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public ScheduleStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    public Schedule createSchedule(NewSchedule data) {
        if (data == null || data.getName() == null || data.getName().isBlank()) {
            throw new JobValidationException("Schedule name is required");
        }
        if (data.getJobName() == null) {
            throw new JobValidationException("Job name is required");
        }
        String timezone = validTimezone(data.getTimezone());
        JobPriority priority = data.getPriority() == null ? JobPriority.NORMAL : data.getPriority();
        String payloadJson = payloadJson(data.getPayload());
        log.info("Creating job schedule name={} jobName={} cron={}",
                data.getName(), data.getJobName(), data.getCronExpression());

        UUID id = UUID.randomUUID();
        Instant now = now();
        try (Connection c = dataSource.getConnection()) {
            if (exists(c, data.getName(), data.getJobName())) {
                log.warn("Job schedule name={} jobName={} already exists", data.getName(), data.getJobName());
                throw new DuplicateScheduleException(data.getName(), data.getJobName());
            }
            String sql = "INSERT INTO job_schedules (id, name, description, job_name, cron_expression, time_zone, "
                    + "is_active, payload, priority, organization_id, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setObject(1, id);
                ps.setString(2, data.getName());
                setText(ps, 3, data.getDescription());
                ps.setString(4, data.getJobName().getValue());
                setText(ps, 5, data.getCronExpression());
                ps.setString(6, timezone);
                ps.setBoolean(7, data.isActive());
                setText(ps, 8, payloadJson);
                ps.setString(9, priority.getValue());
                setText(ps, 10, data.getOrganizationId());
                setInstant(ps, 11, now);
                setInstant(ps, 12, now);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new DuplicateScheduleException(data.getName(), data.getJobName());
            }
            throw failure("createSchedule", e);
        }
        log.info("Job schedule {} created", id);
        return Schedule.builder()
                .id(id)
                .name(data.getName())
                .description(data.getDescription())
                .jobName(data.getJobName())
                .cronExpression(data.getCronExpression())
                .timezone(timezone)
                .active(data.isActive())
                .payload(data.getPayload())
                .priority(priority)
                .organizationId(data.getOrganizationId())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Optional<Schedule> getScheduleById(UUID id) {
        try (Connection c = dataSource.getConnection()) {
            return selectById(c, id, false);
        } catch (SQLException e) {
            throw failure("getScheduleById", e);
        }
    }

    public List<Schedule> listSchedules() {
        return query("listSchedules", "SELECT " + COLUMNS + " FROM job_schedules ORDER BY created_at ASC", List.of());
    }

    /**
     * Active schedules, soonest next run first; never-computed next runs sort last.
     */
    public List<Schedule> listActiveSchedules() {
        return query("listActiveSchedules", "SELECT " + COLUMNS
                + " FROM job_schedules WHERE is_active = TRUE ORDER BY next_run_at ASC NULLS LAST", List.of());
    }

    /** Schedules the scheduler registers triggers for on start. */
    public List<Schedule> listSchedulesToLoad() {
        return query("listSchedulesToLoad", "SELECT " + COLUMNS
                + " FROM job_schedules WHERE is_active = TRUE AND cron_expression IS NOT NULL ORDER BY created_at ASC",
                List.of());
    }

    public List<Schedule> getSchedulesByJobName(JobName jobName) {
        return query("getSchedulesByJobName", "SELECT " + COLUMNS
                + " FROM job_schedules WHERE job_name = ? ORDER BY created_at ASC", List.of(jobName.getValue()));
    }

    /**
     * Active schedules whose next run is due at {@code now}.
     */
    public List<Schedule> getSchedulesReadyToRun(Instant now) {
        return query("getSchedulesReadyToRun", "SELECT " + COLUMNS
                + " FROM job_schedules WHERE is_active = TRUE AND next_run_at <= ? ORDER BY next_run_at ASC",
                List.of(now));
    }

    public Schedule updateSchedule(UUID id, ScheduleUpdate update) {
        log.info("Updating job schedule {}", id);
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            Schedule current = null;
            try {
                current = selectById(c, id, true).orElse(null);
                if (current == null) {
                    c.rollback();
                    throw new ScheduleNotFoundException(id);
                }
                if (update == null || update.isEmpty()) {
                    c.commit();
                    return current;
                }

                List<Object> params = new ArrayList<>();
                StringBuilder sql = new StringBuilder("UPDATE job_schedules SET updated_at = ?");
                params.add(now());
                if (update.getName() != null) {
                    if (update.getName().isBlank()) {
                        throw new JobValidationException("Schedule name is required");
                    }
                    sql.append(", name = ?");
                    params.add(update.getName());
                }
                if (update.hasDescription()) {
                    sql.append(", description = ?");
                    params.add(textOrNull(update.getDescription()));
                }
                if (update.hasCronExpression()) {
                    sql.append(", cron_expression = ?");
                    params.add(textOrNull(update.getCronExpression()));
                }
                if (update.getTimezone() != null) {
                    sql.append(", time_zone = ?");
                    params.add(validTimezone(update.getTimezone()));
                }
                if (update.getActive() != null) {
                    sql.append(", is_active = ?");
                    params.add(update.getActive());
                }
                if (update.hasPayload()) {
                    sql.append(", payload = ?");
                    params.add(textOrNull(payloadJson(update.getPayload())));
                }
                if (update.getPriority() != null) {
                    sql.append(", priority = ?");
                    params.add(update.getPriority().getValue());
                }
                sql.append(" WHERE id = ?");
                params.add(id);

                try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                    bind(ps, params);
                    ps.executeUpdate();
                }
                Schedule updated = selectById(c, id, false).orElseThrow(() -> new ScheduleNotFoundException(id));
                c.commit();
                log.info("Job schedule {} updated", id);
                return updated;
            } catch (SQLException e) {
                rollbackQuietly(c, e);
                if (UNIQUE_VIOLATION.equals(e.getSQLState()) && current != null) {
                    throw new DuplicateScheduleException(update.getName(), current.getJobName());
                }
                throw e;
            } catch (RuntimeException e) {
                try {
                    c.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw failure("updateSchedule", e);
        }
    }

    public void updateScheduleRunTime(UUID id, Instant lastRunAt, Instant nextRunAt) {
        log.debug("Updating job schedule {} run time last={} next={}", id, lastRunAt, nextRunAt);
        String sql = "UPDATE job_schedules SET last_run_at = ?, next_run_at = ?, updated_at = ? WHERE id = ?";
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, List.of(instantOrNull(lastRunAt), instantOrNull(nextRunAt), now(), id));
            if (ps.executeUpdate() == 0) {
                throw new ScheduleNotFoundException(id);
            }
        } catch (SQLException e) {
            throw failure("updateScheduleRunTime", e);
        }
    }

    /** Stores only the next run, used when a trigger is (re)registered. */
    public void updateNextRunAt(UUID id, Instant nextRunAt) {
        String sql = "UPDATE job_schedules SET next_run_at = ?, updated_at = ? WHERE id = ?";
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, List.of(instantOrNull(nextRunAt), now(), id));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("updateNextRunAt", e);
        }
    }

    public boolean deleteSchedule(UUID id) {
        log.info("Deleting job schedule {}", id);
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM job_schedules WHERE id = ?")) {
            ps.setObject(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("deleteSchedule", e);
        }
    }

    private static boolean exists(Connection c, String name, JobName jobName) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT 1 FROM job_schedules WHERE name = ? AND job_name = ?")) {
            ps.setString(1, name);
            ps.setString(2, jobName.getValue());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private Optional<Schedule> selectById(Connection c, UUID id, boolean forUpdate) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM job_schedules WHERE id = ?" + (forUpdate ? " FOR UPDATE" : "");
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private List<Schedule> query(String operation, String sql, List<?> params) {
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, params);
            List<Schedule> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw failure(operation, e);
        }
    }

    private static Schedule map(ResultSet rs) throws SQLException {
        return Schedule.builder()
                .id(getUuid(rs, "id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .jobName(JobName.fromValue(rs.getString("job_name")))
                .cronExpression(rs.getString("cron_expression"))
                .timezone(rs.getString("time_zone"))
                .active(rs.getBoolean("is_active"))
                .payload(JsonColumns.read(rs.getString("payload")))
                .priority(JobPriority.fromValue(rs.getString("priority")))
                .organizationId(rs.getString("organization_id"))
                .lastRunAt(getInstant(rs, "last_run_at"))
                .nextRunAt(getInstant(rs, "next_run_at"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }

    private static String validTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Schedule.DEFAULT_TIME_ZONE;
        }
        try {
            return ZoneId.of(timezone).getId();
        } catch (DateTimeException e) {
            throw new JobValidationException("Invalid time zone: " + timezone);
        }
    }

    private static String payloadJson(Map<String, Object> payload) {
        try {
            return JsonColumns.write(payload);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Invalid schedule payload: " + e.getMessage());
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static StoreException failure(String operation, SQLException e) {
        log.error("Database operation failed: {}", operation, e);
        return new StoreException(operation, e);
    }
}
