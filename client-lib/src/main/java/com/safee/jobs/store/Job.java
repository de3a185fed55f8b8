package com.safee.jobs.store;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * One durable unit of asynchronous work, as read from the jobs table.
 */
public class Job {
    private final UUID id;
    private final JobName jobName;
    private final JobType type;
    private final JobPriority priority;
    private final JobStatus status;
    private final Map<String, Object> payload;
    private final Map<String, Object> result;
    private final String error;
    private final int attempts;
    private final int maxRetries;
    private final Instant scheduledFor;
    private final String organizationId;
    private final UUID scheduleId;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Job(Builder b) {
        this.id = b.id;
        this.jobName = b.jobName;
        this.type = b.type;
        this.priority = b.priority;
        this.status = b.status;
        this.payload = b.payload == null ? Collections.emptyMap() : Collections.unmodifiableMap(b.payload);
        this.result = b.result == null ? null : Collections.unmodifiableMap(b.result);
        this.error = b.error;
        this.attempts = b.attempts;
        this.maxRetries = b.maxRetries;
        this.scheduledFor = b.scheduledFor;
        this.organizationId = b.organizationId;
        this.scheduleId = b.scheduleId;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt;
        this.startedAt = b.startedAt;
        this.completedAt = b.completedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public UUID getId() {
        return id;
    }

    public JobName getJobName() {
        return jobName;
    }

    public JobType getType() {
        return type;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public JobStatus getStatus() {
        return status;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Instant getScheduledFor() {
        return scheduledFor;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public UUID getScheduleId() {
        return scheduleId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", jobName=" + jobName + ", status=" + status + ", priority=" + priority
                + ", attempts=" + attempts + "/" + maxRetries + "}";
    }

    public static class Builder {
        private UUID id;
        private JobName jobName;
        private JobType type;
        private JobPriority priority;
        private JobStatus status;
        private Map<String, Object> payload;
        private Map<String, Object> result;
        private String error;
        private int attempts;
        private int maxRetries;
        private Instant scheduledFor;
        private String organizationId;
        private UUID scheduleId;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder jobName(JobName jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder scheduleId(UUID scheduleId) {
            this.scheduleId = scheduleId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
