package com.safee.jobs.store;

import java.time.Instant;

/** Inclusive createdAt window used by job statistics. */
public class TimeRange {
    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("time range needs both start and end");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("time range start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }
}
