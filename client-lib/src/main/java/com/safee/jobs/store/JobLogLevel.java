package com.safee.jobs.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobLogLevel {
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error");

    private final String value;

    JobLogLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobLogLevel fromValue(String value) {
        for (JobLogLevel candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new JobValidationException("Invalid log level: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
