package com.safee.jobs.store;

import java.util.Map;

/**
 * Partial change to a schedule; only the fields that were set are written.
 * {@link #cronExpression(String)} with null detaches the cron and makes the schedule inert.
 */
public class ScheduleUpdate {
    private String name;
    private String description;
    private boolean descriptionSet;
    private String cronExpression;
    private boolean cronExpressionSet;
    private String timezone;
    private Boolean active;
    private Map<String, Object> payload;
    private boolean payloadSet;
    private JobPriority priority;

    public static ScheduleUpdate none() {
        return new ScheduleUpdate();
    }

    public ScheduleUpdate name(String name) {
        this.name = name;
        return this;
    }

    public ScheduleUpdate description(String description) {
        this.description = description;
        this.descriptionSet = true;
        return this;
    }

    public ScheduleUpdate cronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
        this.cronExpressionSet = true;
        return this;
    }

    public ScheduleUpdate timezone(String timezone) {
        this.timezone = timezone;
        return this;
    }

    public ScheduleUpdate active(boolean active) {
        this.active = active;
        return this;
    }

    public ScheduleUpdate payload(Map<String, Object> payload) {
        this.payload = payload;
        this.payloadSet = true;
        return this;
    }

    public ScheduleUpdate priority(JobPriority priority) {
        this.priority = priority;
        return this;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean hasDescription() {
        return descriptionSet;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public boolean hasCronExpression() {
        return cronExpressionSet;
    }

    public String getTimezone() {
        return timezone;
    }

    public Boolean getActive() {
        return active;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public boolean hasPayload() {
        return payloadSet;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public boolean isEmpty() {
        return name == null && !descriptionSet && !cronExpressionSet && timezone == null && active == null
                && !payloadSet && priority == null;
    }
}
