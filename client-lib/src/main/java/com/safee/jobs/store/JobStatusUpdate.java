package com.safee.jobs.store;

import java.time.Instant;
import java.util.Map;

/**
 * Optional column changes applied together with a status transition by
 * {@link JobStore#updateJobStatus(java.util.UUID, JobStatus, JobStatusUpdate)}.
 */
public class JobStatusUpdate {
    private Instant startedAt;
    private Instant completedAt;
    private Map<String, Object> result;
    private boolean resultSet;
    private String error;
    private boolean errorSet;
    private boolean incrementAttempts;

    public static JobStatusUpdate none() {
        return new JobStatusUpdate();
    }

    public JobStatusUpdate startedAt(Instant startedAt) {
        this.startedAt = startedAt;
        return this;
    }

    /** Only honoured for terminal statuses; otherwise completedAt is cleared. */
    public JobStatusUpdate completedAt(Instant completedAt) {
        this.completedAt = completedAt;
        return this;
    }

    public JobStatusUpdate result(Map<String, Object> result) {
        this.result = result;
        this.resultSet = true;
        return this;
    }

    public JobStatusUpdate error(String error) {
        this.error = error;
        this.errorSet = true;
        return this;
    }

    /** attempts = attempts + 1, evaluated by the database. */
    public JobStatusUpdate incrementAttempts() {
        this.incrementAttempts = true;
        return this;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public boolean hasResult() {
        return resultSet;
    }

    public String getError() {
        return error;
    }

    public boolean hasError() {
        return errorSet;
    }

    public boolean isIncrementAttempts() {
        return incrementAttempts;
    }
}
