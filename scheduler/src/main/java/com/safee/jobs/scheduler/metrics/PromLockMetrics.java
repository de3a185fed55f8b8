package com.safee.jobs.scheduler.metrics;

import com.safee.jobs.lock.LockMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

/**
 * Prometheus-backed implementation of LockMetrics for the schedule fire guard.
 */
public class PromLockMetrics implements LockMetrics {
    private final Counter acquireAttempts;
    private final Counter acquireSuccess;
    private final Counter acquireContended;
    private final Counter retryExhausted;
    private final Histogram storeLatencySeconds;

    public PromLockMetrics(CollectorRegistry registry) {
        this.acquireAttempts = Counter.build()
                .name("lock_acquire_attempt_total")
                .help("Total lock acquire attempts")
                .register(registry);
        this.acquireSuccess = Counter.build()
                .name("lock_acquire_success_total")
                .help("Total successful lock acquires")
                .register(registry);
        this.acquireContended = Counter.build()
                .name("lock_acquire_contended_total")
                .help("Total acquires that found the lease taken")
                .register(registry);
        this.retryExhausted = Counter.build()
                .name("lock_retry_exhausted_total")
                .help("Total acquireWithRetry calls that gave up")
                .register(registry);
        this.storeLatencySeconds = Histogram.build()
                .name("lease_store_latency_seconds")
                .help("Latency of lease store operations in seconds")
                .buckets(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
                .labelNames("op")
                .register(registry);
    }

    @Override
    public void observeStoreLatencySeconds(String op, double seconds) {
        storeLatencySeconds.labels(op).observe(seconds);
    }

    @Override
    public void incAcquireAttempt() {
        acquireAttempts.inc();
    }

    @Override
    public void incAcquireSuccess() {
        acquireSuccess.inc();
    }

    @Override
    public void incAcquireContended() {
        acquireContended.inc();
    }

    @Override
    public void incRetryExhausted() {
        retryExhausted.inc();
    }
}
