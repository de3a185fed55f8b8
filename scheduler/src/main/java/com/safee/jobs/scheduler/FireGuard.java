package com.safee.jobs.scheduler;

import java.time.Instant;
import java.util.UUID;

/**
 * Decides whether this process acts on one fire of a schedule. With several scheduler
 * processes running the same schedules, at most one should get {@code true} per fire.
 */
public interface FireGuard {

    boolean tryClaim(UUID scheduleId, Instant fireTime);

    /** Single-process mode: every fire is ours. */
    static FireGuard always() {
        return (scheduleId, fireTime) -> true;
    }
}
