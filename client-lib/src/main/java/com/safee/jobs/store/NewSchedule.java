package com.safee.jobs.store;

import java.util.Map;

/**
 * Input of {@link ScheduleStore#createSchedule(NewSchedule)}.
 */
public class NewSchedule {
    private String name;
    private String description;
    private JobName jobName;
    private String cronExpression;
    private String timezone = Schedule.DEFAULT_TIME_ZONE;
    private boolean active = true;
    private Map<String, Object> payload;
    private JobPriority priority = JobPriority.NORMAL;
    private String organizationId;

    public static NewSchedule of(String name, JobName jobName) {
        NewSchedule s = new NewSchedule();
        s.name = name;
        s.jobName = jobName;
        return s;
    }

    public NewSchedule description(String description) {
        this.description = description;
        return this;
    }

    public NewSchedule cronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
        return this;
    }

    public NewSchedule timezone(String timezone) {
        this.timezone = timezone;
        return this;
    }

    public NewSchedule active(boolean active) {
        this.active = active;
        return this;
    }

    public NewSchedule payload(Map<String, Object> payload) {
        this.payload = payload;
        return this;
    }

    public NewSchedule priority(JobPriority priority) {
        this.priority = priority;
        return this;
    }

    public NewSchedule organizationId(String organizationId) {
        this.organizationId = organizationId;
        return this;
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
}
