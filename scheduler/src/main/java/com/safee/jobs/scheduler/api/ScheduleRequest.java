package com.safee.jobs.scheduler.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Body of POST and PUT /schedules. On PUT, absent fields are left alone; an explicit
 * {@code "cronExpression": null} detaches the cron.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleRequest {
    private String name;
    private String description;
    private boolean descriptionSet;
    private String jobName;
    private String cronExpression;
    private boolean cronExpressionSet;
    private String timezone;
    private Boolean active;
    private Map<String, Object> payload;
    private boolean payloadSet;
    private String priority;
    private String organizationId;

    public ScheduleRequest() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
        this.descriptionSet = true;
    }

    public boolean hasDescription() {
        return descriptionSet;
    }

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
        this.cronExpressionSet = true;
    }

    public boolean hasCronExpression() {
        return cronExpressionSet;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Boolean getActive() {
        return active;
    }

    @JsonAlias("isActive")
    public void setActive(Boolean active) {
        this.active = active;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
        this.payloadSet = true;
    }

    public boolean hasPayload() {
        return payloadSet;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }
}
