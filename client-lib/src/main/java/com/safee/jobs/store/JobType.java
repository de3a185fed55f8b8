package com.safee.jobs.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a job came to exist, not how it runs. */
public enum JobType {
    IMMEDIATE("immediate"),
    SCHEDULED("scheduled"),
    CRON("cron"),
    RECURRING("recurring");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobType fromValue(String value) {
        for (JobType candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new JobValidationException("Invalid job type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
