package com.safee.jobs.store;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Input of {@link JobStore#createJob(NewJob)}. Type defaults to immediate, priority to normal.
 */
public class NewJob {
    public static final int DEFAULT_MAX_RETRIES = 3;

    private JobName jobName;
    private JobType type = JobType.IMMEDIATE;
    private JobPriority priority = JobPriority.NORMAL;
    private Map<String, Object> payload;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Instant scheduledFor;
    private String organizationId;
    private UUID scheduleId;

    public static NewJob of(JobName jobName) {
        NewJob job = new NewJob();
        job.jobName = jobName;
        return job;
    }

    public NewJob type(JobType type) {
        this.type = type;
        return this;
    }

    public NewJob priority(JobPriority priority) {
        this.priority = priority;
        return this;
    }

    public NewJob payload(Map<String, Object> payload) {
        this.payload = payload;
        return this;
    }

    public NewJob maxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public NewJob scheduledFor(Instant scheduledFor) {
        this.scheduledFor = scheduledFor;
        return this;
    }

    public NewJob organizationId(String organizationId) {
        this.organizationId = organizationId;
        return this;
    }

    public NewJob scheduleId(UUID scheduleId) {
        this.scheduleId = scheduleId;
        return this;
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

    public Map<String, Object> getPayload() {
        return payload;
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
}
