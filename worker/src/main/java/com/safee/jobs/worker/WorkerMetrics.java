package com.safee.jobs.worker;

public interface WorkerMetrics {
    WorkerMetrics NOOP = new WorkerMetrics() {
    };

    default void jobStarted() {
    }

    default void jobFinished(RunOutcome outcome, double durationSeconds) {
    }
}
