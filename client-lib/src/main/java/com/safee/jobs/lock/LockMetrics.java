package com.safee.jobs.lock;

/**
 * Minimal metrics hook for LockClient. Default is no-op.
 */
public interface LockMetrics {
    void observeStoreLatencySeconds(String op, double seconds);

    void incAcquireAttempt();

    void incAcquireSuccess();

    void incAcquireContended();

    void incRetryExhausted();

    static LockMetrics noop() {
        return new LockMetrics() {
            public void observeStoreLatencySeconds(String op, double seconds) {
            }

            public void incAcquireAttempt() {
            }

            public void incAcquireSuccess() {
            }

            public void incAcquireContended() {
            }

            public void incRetryExhausted() {
            }
        };
    }
}
