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
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.safee.jobs.db.Jdbc.bind;
import static com.safee.jobs.db.Jdbc.getInstant;
import static com.safee.jobs.db.Jdbc.getUuid;
import static com.safee.jobs.db.Jdbc.setInstant;
import static com.safee.jobs.db.Jdbc.setText;

/**
 * Per-job audit trail. Rows go away with their job.
 */
public class JobLogStore {
    private static final Logger log = LoggerFactory.getLogger(JobLogStore.class);

    public static final int DEFAULT_LIMIT = 100;

    private final DataSource dataSource;
    private final Clock clock;

    public JobLogStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JobLogStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    public JobLog createJobLog(UUID jobId, JobLogLevel level, String message, Map<String, Object> metadata) {
        if (jobId == null || level == null || message == null) {
            throw new JobValidationException("jobId, level and message are required for a job log");
        }
        String metadataJson;
        try {
            metadataJson = JsonColumns.write(metadata);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Invalid job log metadata: " + e.getMessage());
        }
        UUID id = UUID.randomUUID();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        String sql = "INSERT INTO job_logs (id, job_id, log_level, message, metadata, created_at) VALUES (?, ?, ?, ?, ?, ?)";
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            ps.setObject(2, jobId);
            ps.setString(3, level.getValue());
            ps.setString(4, message);
            setText(ps, 5, metadataJson);
            setInstant(ps, 6, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("createJobLog", e);
        }
        log.debug("Job log {} [{}] {}", jobId, level, message);
        return new JobLog(id, jobId, level, message, metadata, now);
    }

    public JobLog info(UUID jobId, String message) {
        return info(jobId, message, null);
    }

    public JobLog info(UUID jobId, String message, Map<String, Object> metadata) {
        return createJobLog(jobId, JobLogLevel.INFO, message, metadata);
    }

    public JobLog warn(UUID jobId, String message, Map<String, Object> metadata) {
        return createJobLog(jobId, JobLogLevel.WARN, message, metadata);
    }

    public JobLog error(UUID jobId, String message, Map<String, Object> metadata) {
        return createJobLog(jobId, JobLogLevel.ERROR, message, metadata);
    }

    public JobLog debug(UUID jobId, String message, Map<String, Object> metadata) {
        return createJobLog(jobId, JobLogLevel.DEBUG, message, metadata);
    }

    public List<JobLog> getJobLogs(UUID jobId) {
        return getJobLogs(jobId, null, DEFAULT_LIMIT, 0);
    }

    /**
     * Newest first.
     *
     * @param levels null or empty for every level
     */
    public List<JobLog> getJobLogs(UUID jobId, Collection<JobLogLevel> levels, int limit, int offset) {
        if (limit <= 0 || offset < 0) {
            throw new IllegalArgumentException("limit must be > 0 and offset >= 0, got: " + limit + ", " + offset);
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(
                "SELECT id, job_id, log_level, message, metadata, created_at FROM job_logs WHERE job_id = ?");
        params.add(jobId);
        if (levels != null && !levels.isEmpty()) {
            sql.append(" AND log_level IN (");
            boolean first = true;
            for (JobLogLevel level : levels) {
                sql.append(first ? "?" : ", ?");
                params.add(level.getValue());
                first = false;
            }
            sql.append(')');
        }
        sql.append(" ORDER BY created_at DESC LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);

        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            bind(ps, params);
            List<JobLog> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new JobLog(
                            getUuid(rs, "id"),
                            getUuid(rs, "job_id"),
                            JobLogLevel.fromValue(rs.getString("log_level")),
                            rs.getString("message"),
                            JsonColumns.read(rs.getString("metadata")),
                            getInstant(rs, "created_at")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw failure("getJobLogs", e);
        }
    }

    public List<JobLog> getJobErrorLogs(UUID jobId) {
        return getJobLogs(jobId, EnumSet.of(JobLogLevel.ERROR, JobLogLevel.WARN), DEFAULT_LIMIT, 0);
    }

    /**
     * Deletes logs created before {@code olderThan}.
     *
     * @return number of rows removed
     */
    public int cleanupOldJobLogs(Instant olderThan) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM job_logs WHERE created_at < ?")) {
            setInstant(ps, 1, olderThan);
            int removed = ps.executeUpdate();
            log.info("Cleaned up {} job logs older than {}", removed, olderThan);
            return removed;
        } catch (SQLException e) {
            throw failure("cleanupOldJobLogs", e);
        }
    }

    private static StoreException failure(String operation, SQLException e) {
        log.error("Database operation failed: {}", operation, e);
        return new StoreException(operation, e);
    }
}
