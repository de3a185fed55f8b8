package com.safee.jobs.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory, lease-based lock on top of a {@link LeaseStore}.
 * Implements:
 * - acquire(key, ttlSeconds) : one atomic set-if-absent with expiry
 * - acquireWithRetry(options) : fixed-delay retries of acquire
 *
 * Notes:
 * - There is no release and no owner token. A lease ends when its TTL expires, so the TTL must
 *   outlive the section it guards.
 * - Not reentrant: a second acquire by the same caller fails like any other contender.
 */
public class LockClient {
    public static final String LOCK_VALUE = "In use";

    private static final Logger log = LoggerFactory.getLogger(LockClient.class);

    private final LeaseStore store;
    private final LockMetrics metrics;
    private final Sleeper sleeper;

    public LockClient(LeaseStore store) {
        this(store, LockMetrics.noop());
    }

    public LockClient(LeaseStore store, LockMetrics metrics) {
        this(store, metrics, Sleeper.threadSleep());
    }

    LockClient(LeaseStore store, LockMetrics metrics, Sleeper sleeper) {
        if (store == null) {
            throw new IllegalArgumentException("lease store is required");
        }
        this.store = store;
        this.metrics = (metrics == null ? LockMetrics.noop() : metrics);
        this.sleeper = sleeper;
    }

    /**
     * Try acquire once (non-blocking).
     *
     * @return true iff this call created the lease
     */
    public boolean acquire(String key, int ttlSeconds) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("lock key is required");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0, got: " + ttlSeconds);
        }
        metrics.incAcquireAttempt();
        long t0 = System.nanoTime();
        boolean applied = store.setIfAbsent(key, LOCK_VALUE, ttlSeconds);
        metrics.observeStoreLatencySeconds("acquire.set_if_absent", (System.nanoTime() - t0) / 1_000_000_000.0);
        if (applied) {
            metrics.incAcquireSuccess();
        } else {
            metrics.incAcquireContended();
        }
        return applied;
    }

    /**
     * Up to {@code maxRetries + 1} acquire attempts with a fixed delay in between.
     * Returns false instead of throwing when the lease stays taken.
     */
    public boolean acquireWithRetry(AcquireOptions options) {
        String key = options.getKey();
        int maxRetries = options.getMaxRetries();
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (acquire(key, options.getTtlSeconds())) {
                return true;
            }
            if (attempt < maxRetries) {
                log.warn("Failed to get lock {}, retrying in {} ms (attempt {}/{})",
                        key, options.getRetryDelayMs(), attempt + 1, maxRetries + 1);
                try {
                    sleeper.sleep(options.getRetryDelayMs());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting to retry lock {}", key);
                    return false;
                }
            }
        }
        metrics.incRetryExhausted();
        log.warn("Failed to get lock {} even after {} retries", key, maxRetries);
        return false;
    }
}
