package com.safee.jobs.store;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/** One line of a job's audit trail. */
public class JobLog {
    private final UUID id;
    private final UUID jobId;
    private final JobLogLevel level;
    private final String message;
    private final Map<String, Object> metadata;
    private final Instant createdAt;

    public JobLog(UUID id, UUID jobId, JobLogLevel level, String message, Map<String, Object> metadata,
                  Instant createdAt) {
        this.id = id;
        this.jobId = jobId;
        this.level = level;
        this.message = message;
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(metadata);
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getJobId() {
        return jobId;
    }

    public JobLogLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
