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
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
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
import static com.safee.jobs.db.Jdbc.setUuid;
import static com.safee.jobs.db.Jdbc.textOrNull;

/**
 * Durable ledger of jobs and owner of the job state machine.
 * The store never executes work; workers report back through startJob / completeJob / failJob.
 */
public class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    static final String COLUMNS = "id, job_name, job_type, priority, status, payload, result, error, attempts, "
            + "max_retries, scheduled_for, organization_id, schedule_id, created_at, updated_at, started_at, completed_at";

    private final DataSource dataSource;
    private final Clock clock;

    public JobStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JobStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    public Job createJob(NewJob data) {
        validate(data);
        String payloadJson;
        try {
            payloadJson = JsonColumns.write(data.getPayload());
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Invalid job payload: " + e.getMessage());
        }
        log.info("Creating job name={} type={} priority={}",
                data.getJobName(), data.getType(), data.getPriority());

        UUID id = UUID.randomUUID();
        Instant now = now();
        String sql = "INSERT INTO jobs (id, job_name, job_type, priority, status, payload, attempts, max_retries, "
                + "scheduled_for, organization_id, schedule_id, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, 0, ?, ?, ?, ?, ?, ?)";
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            ps.setString(2, data.getJobName().getValue());
            ps.setString(3, data.getType().getValue());
            ps.setString(4, data.getPriority().getValue());
            ps.setString(5, JobStatus.PENDING.getValue());
            setText(ps, 6, payloadJson);
            ps.setInt(7, data.getMaxRetries());
            setInstant(ps, 8, data.getScheduledFor());
            setText(ps, 9, data.getOrganizationId());
            setUuid(ps, 10, data.getScheduleId());
            setInstant(ps, 11, now);
            setInstant(ps, 12, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("createJob", e);
        }

        Job created = Job.builder()
                .id(id)
                .jobName(data.getJobName())
                .type(data.getType())
                .priority(data.getPriority())
                .status(JobStatus.PENDING)
                .payload(data.getPayload())
                .attempts(0)
                .maxRetries(data.getMaxRetries())
                .scheduledFor(truncate(data.getScheduledFor()))
                .organizationId(data.getOrganizationId())
                .scheduleId(data.getScheduleId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        log.info("Job {} created (status={})", id, created.getStatus());
        return created;
    }

    /**
     * @return the job, or empty when no row has this id
     */
    public Optional<Job> getJobById(UUID id) {
        log.debug("Getting job {}", id);
        try (Connection c = dataSource.getConnection()) {
            Optional<Job> job = selectById(c, id, false);
            if (job.isEmpty()) {
                log.warn("Job {} not found", id);
            }
            return job;
        } catch (SQLException e) {
            throw failure("getJobById", e);
        }
    }

    public List<Job> getJobsByStatus(JobStatus... statuses) {
        return getJobsByStatus(Arrays.asList(statuses));
    }

    public List<Job> getJobsByStatus(Collection<JobStatus> statuses) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        log.debug("Getting jobs by status {}", statuses);
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM jobs WHERE status IN (");
        List<Object> params = new ArrayList<>();
        for (JobStatus status : statuses) {
            sql.append(params.isEmpty() ? "?" : ", ?");
            params.add(status.getValue());
        }
        sql.append(") ").append(DispatchOrder.ORDER_BY_SQL);
        return query("getJobsByStatus", sql.toString(), params);
    }

    public List<Job> getPendingJobs(int limit) {
        return getPendingJobs(limit, null);
    }

    /**
     * Pending jobs that are due now: scheduledFor is null or not in the future.
     */
    public List<Job> getPendingJobs(int limit, String organizationId) {
        requirePositive(limit);
        log.debug("Getting pending jobs limit={} organizationId={}", limit, organizationId);
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
                .append(" FROM jobs WHERE status = ? AND (scheduled_for IS NULL OR scheduled_for <= ?)");
        params.add(JobStatus.PENDING.getValue());
        params.add(now());
        if (organizationId != null) {
            sql.append(" AND organization_id = ?");
            params.add(organizationId);
        }
        sql.append(' ').append(DispatchOrder.ORDER_BY_SQL).append(" LIMIT ?");
        params.add(limit);
        List<Job> jobs = query("getPendingJobs", sql.toString(), params);
        log.info("Retrieved {} pending jobs (limit {})", jobs.size(), limit);
        return jobs;
    }

    /**
     * Failed jobs that still have retries left. A job with attempts >= maxRetries never shows up here.
     */
    public List<Job> getRetryableJobs(int limit) {
        requirePositive(limit);
        log.debug("Getting retryable jobs limit={}", limit);
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE status = ? AND attempts < max_retries "
                + DispatchOrder.ORDER_BY_SQL + " LIMIT ?";
        List<Job> jobs = query("getRetryableJobs", sql, List.of(JobStatus.FAILED.getValue(), limit));
        log.info("Retrieved {} retryable jobs", jobs.size());
        return jobs;
    }

    /**
     * Moves a job to {@code status}, applying the optional column changes of {@code update}.
     * Always stamps updatedAt. Terminal statuses get completedAt (the supplied one, or now);
     * any other status clears it.
     *
     * @throws JobNotFoundException when no row has this id
     */
    public Job updateJobStatus(UUID id, JobStatus status, JobStatusUpdate update) {
        log.info("Updating job {} status to {}", id, status);
        return transition(id, status, update, false)
                .orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * Empty when {@code refuseTerminal} is set and the locked row is already terminal.
     */
    private Optional<Job> transition(UUID id, JobStatus status, JobStatusUpdate update, boolean refuseTerminal) {
        JobStatusUpdate fields = update == null ? JobStatusUpdate.none() : update;
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<Job> current = selectById(c, id, true);
                if (current.isEmpty()) {
                    c.rollback();
                    log.error("Job {} not found for status update", id);
                    throw new JobNotFoundException(id);
                }
                if (refuseTerminal && current.get().getStatus().isTerminal()) {
                    c.rollback();
                    log.info("Job {} is already {}, refusing {}", id, current.get().getStatus(), status);
                    return Optional.empty();
                }

                Instant now = now();
                Instant completedAt = null;
                if (status.isTerminal()) {
                    completedAt = fields.getCompletedAt() != null ? fields.getCompletedAt() : now;
                }

                List<Object> params = new ArrayList<>();
                StringBuilder sql = new StringBuilder("UPDATE jobs SET status = ?, updated_at = ?, completed_at = ?");
                params.add(status.getValue());
                params.add(now);
                params.add(instantOrNull(completedAt));
                if (fields.getStartedAt() != null) {
                    sql.append(", started_at = ?");
                    params.add(fields.getStartedAt());
                }
                if (fields.hasResult()) {
                    sql.append(", result = ?");
                    params.add(textOrNull(JsonColumns.write(fields.getResult())));
                }
                if (fields.hasError()) {
                    sql.append(", error = ?");
                    params.add(textOrNull(fields.getError()));
                }
                if (fields.isIncrementAttempts()) {
                    sql.append(", attempts = attempts + 1");
                }
                sql.append(" WHERE id = ?");
                params.add(id);

                try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                    bind(ps, params);
                    ps.executeUpdate();
                }
                Job updated = selectById(c, id, false).orElseThrow(() -> new JobNotFoundException(id));
                c.commit();
                log.info("Job {} status updated to {} (attempts={})", id, updated.getStatus(), updated.getAttempts());
                return Optional.of(updated);
            } catch (SQLException | RuntimeException e) {
                if (e instanceof SQLException) {
                    rollbackQuietly(c, (SQLException) e);
                } else {
                    try {
                        c.rollback();
                    } catch (SQLException rollbackFailure) {
                        e.addSuppressed(rollbackFailure);
                    }
                }
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw failure("updateJobStatus", e);
        }
    }

    /**
     * running, startedAt = now, attempts + 1.
     */
    public Job startJob(UUID id) {
        log.info("Starting job {}", id);
        return updateJobStatus(id, JobStatus.RUNNING, startUpdate());
    }

    /**
     * {@link #startJob(UUID)} unless the row is completed, failed or cancelled when locked.
     * The status check and the update share one transaction.
     *
     * @return the running job, or empty when the row was already terminal
     * @throws JobNotFoundException when no row has this id
     */
    public Optional<Job> startJobUnlessTerminal(UUID id) {
        log.info("Starting job {} unless terminal", id);
        return transition(id, JobStatus.RUNNING, startUpdate(), true);
    }

    private JobStatusUpdate startUpdate() {
        return JobStatusUpdate.none()
                .startedAt(now())
                .incrementAttempts();
    }

    public Job completeJob(UUID id, Map<String, Object> result) {
        log.info("Completing job {}", id);
        return updateJobStatus(id, JobStatus.COMPLETED, JobStatusUpdate.none()
                .result(result)
                .completedAt(now()));
    }

    /**
     * retrying (no completedAt) when {@code shouldRetry}, otherwise failed with completedAt.
     */
    public Job failJob(UUID id, String error, boolean shouldRetry) {
        log.info("Failing job {} retry={} error={}", id, shouldRetry, error);
        JobStatusUpdate update = JobStatusUpdate.none().error(error);
        if (!shouldRetry) {
            update.completedAt(now());
        }
        return updateJobStatus(id, shouldRetry ? JobStatus.RETRYING : JobStatus.FAILED, update);
    }

    /**
     * Forces cancelled regardless of the current status.
     */
    public Job cancelJob(UUID id) {
        log.info("Cancelling job {}", id);
        return updateJobStatus(id, JobStatus.CANCELLED, JobStatusUpdate.none().completedAt(now()));
    }

    public boolean deleteJob(UUID id) {
        log.info("Deleting job {}", id);
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
            ps.setObject(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("deleteJob", e);
        }
    }

    public JobStats getJobStats() {
        return getJobStats(null, null);
    }

    /**
     * Counts by status, type and priority in a single conditional-count query.
     */
    public JobStats getJobStats(String organizationId, TimeRange timeRange) {
        log.debug("Getting job stats organizationId={}", organizationId);
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) AS total");
        for (JobStatus status : JobStatus.values()) {
            sql.append(countWhen("status", status.getValue(), "status_" + status.getValue()));
        }
        for (JobType type : JobType.values()) {
            sql.append(countWhen("job_type", type.getValue(), "type_" + type.getValue()));
        }
        for (JobPriority priority : JobPriority.values()) {
            sql.append(countWhen("priority", priority.getValue(), "priority_" + priority.getValue()));
        }
        sql.append(" FROM jobs WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (organizationId != null) {
            sql.append(" AND organization_id = ?");
            params.add(organizationId);
        }
        if (timeRange != null) {
            sql.append(" AND created_at >= ? AND created_at <= ?");
            params.add(timeRange.getStart());
            params.add(timeRange.getEnd());
        }

        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
                Map<JobType, Long> byType = new EnumMap<>(JobType.class);
                Map<JobPriority, Long> byPriority = new EnumMap<>(JobPriority.class);
                long total = 0;
                if (rs.next()) {
                    total = rs.getLong("total");
                    for (JobStatus status : JobStatus.values()) {
                        byStatus.put(status, rs.getLong("status_" + status.getValue()));
                    }
                    for (JobType type : JobType.values()) {
                        byType.put(type, rs.getLong("type_" + type.getValue()));
                    }
                    for (JobPriority priority : JobPriority.values()) {
                        byPriority.put(priority, rs.getLong("priority_" + priority.getValue()));
                    }
                }
                JobStats stats = new JobStats(total, byStatus, byType, byPriority);
                log.info("Retrieved job stats total={}", stats.getTotal());
                return stats;
            }
        } catch (SQLException e) {
            throw failure("getJobStats", e);
        }
    }

    private static String countWhen(String column, String value, String alias) {
        return ", COALESCE(SUM(CASE WHEN " + column + " = '" + value + "' THEN 1 ELSE 0 END), 0) AS " + alias;
    }

    private Optional<Job> selectById(Connection c, UUID id, boolean forUpdate) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE id = ?" + (forUpdate ? " FOR UPDATE" : "");
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private List<Job> query(String operation, String sql, List<?> params) {
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, params);
            List<Job> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(map(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw failure(operation, e);
        }
    }

    static Job map(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(getUuid(rs, "id"))
                .jobName(JobName.fromValue(rs.getString("job_name")))
                .type(JobType.fromValue(rs.getString("job_type")))
                .priority(JobPriority.fromValue(rs.getString("priority")))
                .status(JobStatus.fromValue(rs.getString("status")))
                .payload(JsonColumns.read(rs.getString("payload")))
                .result(JsonColumns.read(rs.getString("result")))
                .error(rs.getString("error"))
                .attempts(rs.getInt("attempts"))
                .maxRetries(rs.getInt("max_retries"))
                .scheduledFor(getInstant(rs, "scheduled_for"))
                .organizationId(rs.getString("organization_id"))
                .scheduleId(getUuid(rs, "schedule_id"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .startedAt(getInstant(rs, "started_at"))
                .completedAt(getInstant(rs, "completed_at"))
                .build();
    }

    private static void validate(NewJob data) {
        if (data == null) {
            throw new JobValidationException("Job data is required");
        }
        if (data.getJobName() == null) {
            throw new JobValidationException("Job name is required");
        }
        if (data.getType() == null) {
            throw new JobValidationException("Job type is required");
        }
        if (data.getPriority() == null) {
            throw new JobValidationException("Job priority is required");
        }
        if (data.getMaxRetries() < 0) {
            throw new JobValidationException("maxRetries must be >= 0, got: " + data.getMaxRetries());
        }
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static Instant truncate(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MICROS);
    }

    private static StoreException failure(String operation, SQLException e) {
        log.error("Database operation failed: {}", operation, e);
        return new StoreException(operation, e);
    }
}
