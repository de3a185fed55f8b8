package com.safee.jobs.worker.metrics;

import com.safee.jobs.worker.RunOutcome;
import com.safee.jobs.worker.WorkerMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

public class PromWorkerMetrics implements WorkerMetrics {
    private final Counter jobsProcessedTotal;
    private final Gauge jobsInProgress;
    private final Histogram jobDurationSeconds;
    private final Counter jobsFailedPermanentlyTotal;

    public PromWorkerMetrics(CollectorRegistry registry) {
        this.jobsProcessedTotal = Counter.build()
                .name("jobs_processed_total")
                .help("Total jobs processed by status")
                .labelNames("status")
                .register(registry);
        this.jobsInProgress = Gauge.build()
                .name("jobs_in_progress")
                .help("Current jobs in progress")
                .register(registry);
        this.jobDurationSeconds = Histogram.build()
                .name("job_duration_seconds")
                .help("Job execution duration in seconds")
                .buckets(0.05, 0.1, 0.25, 0.5, 1, 2, 5, 10, 30, 60)
                .register(registry);
        this.jobsFailedPermanentlyTotal = Counter.build()
                .name("jobs_failed_permanently_total")
                .help("Jobs that ran out of retries or failed without retry")
                .register(registry);
    }

    @Override
    public void jobStarted() {
        jobsInProgress.inc();
    }

    @Override
    public void jobFinished(RunOutcome outcome, double durationSeconds) {
        jobsInProgress.dec();
        jobsProcessedTotal.labels(outcome.label()).inc();
        jobDurationSeconds.observe(durationSeconds);
        if (outcome == RunOutcome.FAILED) {
            jobsFailedPermanentlyTotal.inc();
        }
    }
}
