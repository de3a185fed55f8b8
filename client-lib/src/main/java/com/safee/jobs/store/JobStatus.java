package com.safee.jobs.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle:
 * <pre>
 * pending  --start-->    running --complete--> completed*
 * running  --fail(retry=false)--> failed*
 * running  --fail(retry=true)-->  retrying --redelivery--> running
 * pending|running|retrying --cancel--> cancelled*
 * </pre>
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    RETRYING("retrying");

    private static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** completedAt is set exactly for these. */
    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new JobValidationException("Invalid job status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
