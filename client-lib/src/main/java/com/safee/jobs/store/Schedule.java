package com.safee.jobs.store;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * A recurring rule that spawns jobs of one kind. A null cron expression makes the schedule inert.
 */
public class Schedule {
    public static final String DEFAULT_TIME_ZONE = "UTC";

    private final UUID id;
    private final String name;
    private final String description;
    private final JobName jobName;
    private final String cronExpression;
    private final String timezone;
    private final boolean active;
    private final Map<String, Object> payload;
    private final JobPriority priority;
    private final String organizationId;
    private final Instant lastRunAt;
    private final Instant nextRunAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Schedule(Builder b) {
        this.id = b.id;
        this.name = b.name;
        this.description = b.description;
        this.jobName = b.jobName;
        this.cronExpression = b.cronExpression;
        this.timezone = b.timezone == null ? DEFAULT_TIME_ZONE : b.timezone;
        this.active = b.active;
        this.payload = b.payload == null ? Collections.emptyMap() : Collections.unmodifiableMap(b.payload);
        this.priority = b.priority == null ? JobPriority.NORMAL : b.priority;
        this.organizationId = b.organizationId;
        this.lastRunAt = b.lastRunAt;
        this.nextRunAt = b.nextRunAt;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JobName getJobName() {
        return jobName;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public boolean isActive() {
        return active;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "Schedule{id=" + id + ", name=" + name + ", jobName=" + jobName + ", cron=" + cronExpression
                + ", tz=" + timezone + ", active=" + active + "}";
    }

    public static class Builder {
        private UUID id;
        private String name;
        private String description;
        private JobName jobName;
        private String cronExpression;
        private String timezone;
        private boolean active = true;
        private Map<String, Object> payload;
        private JobPriority priority;
        private String organizationId;
        private Instant lastRunAt;
        private Instant nextRunAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder jobName(JobName jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
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

        public Schedule build() {
            return new Schedule(this);
        }
    }
}
