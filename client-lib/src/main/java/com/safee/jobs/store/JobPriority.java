package com.safee.jobs.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job priority. Total order by {@link #rank()}: critical (0) before high, normal, low (3).
 */
public enum JobPriority {
    CRITICAL("critical", 0),
    HIGH("high", 1),
    NORMAL("normal", 2),
    LOW("low", 3);

    private final String value;
    private final int rank;

    JobPriority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int rank() {
        return rank;
    }

    @JsonCreator
    public static JobPriority fromValue(String value) {
        for (JobPriority candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new JobValidationException("Invalid job priority: " + value);
    }

    /** Inverse of {@link #rank()}; unknown ranks fall back to normal. */
    public static JobPriority fromRank(int rank) {
        for (JobPriority candidate : values()) {
            if (candidate.rank == rank) {
                return candidate;
            }
        }
        return NORMAL;
    }

    @Override
    public String toString() {
        return value;
    }
}
