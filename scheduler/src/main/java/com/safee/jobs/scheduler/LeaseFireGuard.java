package com.safee.jobs.scheduler;

import com.safee.jobs.lock.LockClient;

import java.time.Instant;
import java.util.UUID;

/**
 * FireGuard on the lease lock. The key names the schedule and the fire second, so every
 * process firing the same occurrence competes for the same lease.
 */
public class LeaseFireGuard implements FireGuard {
    static final String KEY_PREFIX = "job-scheduler:schedule:";

    private final LockClient lockClient;
    private final int ttlSeconds;

    public LeaseFireGuard(LockClient lockClient, int ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0, got: " + ttlSeconds);
        }
        this.lockClient = lockClient;
        this.ttlSeconds = ttlSeconds;
    }

    @Override
    public boolean tryClaim(UUID scheduleId, Instant fireTime) {
        return lockClient.acquire(key(scheduleId, fireTime), ttlSeconds);
    }

    static String key(UUID scheduleId, Instant fireTime) {
        return KEY_PREFIX + scheduleId + ":" + fireTime.getEpochSecond();
    }
}
