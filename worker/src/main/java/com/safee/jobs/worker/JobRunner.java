package com.safee.jobs.worker;

import com.safee.jobs.queue.MessageSource;
import com.safee.jobs.queue.QueueMessage;
import com.safee.jobs.store.Job;
import com.safee.jobs.store.JobLogStore;
import com.safee.jobs.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the job behind one claimed message and reports the outcome to the job store.
 * Each delivery produces one start and one completed/retrying/failed transition.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobStore jobStore;
    private final JobLogStore jobLogStore;
    private final JobProcessorRegistry processors;
    private final MessageSource source;
    private final RetryBackoff backoff;
    private final WorkerMetrics metrics;
    private final Clock clock;

    public JobRunner(JobStore jobStore, JobLogStore jobLogStore, JobProcessorRegistry processors,
                     MessageSource source, RetryBackoff backoff, WorkerMetrics metrics, Clock clock) {
        this.jobStore = jobStore;
        this.jobLogStore = jobLogStore;
        this.processors = processors;
        this.source = source;
        this.backoff = backoff;
        this.metrics = metrics == null ? WorkerMetrics.NOOP : metrics;
        this.clock = clock;
    }

    public RunOutcome run(QueueMessage message) {
        UUID jobId = message.jobId();
        if (jobId == null) {
            log.warn("Dropping message {} on {}: no job id", message.getMessageId(), message.getQueueName());
            return RunOutcome.DROPPED;
        }
        Optional<Job> found = jobStore.getJobById(jobId);
        if (found.isEmpty()) {
            log.warn("Dropping message {}: job {} does not exist", message.getMessageId(), jobId);
            return RunOutcome.DROPPED;
        }
        if (found.get().getStatus().isTerminal()) {
            log.info("Job {} is {}, skipping delivery {}", jobId, found.get().getStatus(), message.getDelivery());
            return RunOutcome.SKIPPED;
        }
        // the row may have been cancelled since the read above
        Optional<Job> started = jobStore.startJobUnlessTerminal(jobId);
        if (started.isEmpty()) {
            log.info("Job {} became terminal before start, skipping delivery {}", jobId, message.getDelivery());
            return RunOutcome.SKIPPED;
        }

        long t0 = System.nanoTime();
        metrics.jobStarted();
        RunOutcome outcome = execute(started.get(), message);
        metrics.jobFinished(outcome, (System.nanoTime() - t0) / 1_000_000_000.0);
        return outcome;
    }

    private RunOutcome execute(Job job, QueueMessage message) {
        jobLogStore.info(job.getId(), "Job started", meta("attempt", job.getAttempts()));
        Optional<JobProcessor> processor = processors.find(job.getJobName());
        if (processor.isEmpty()) {
            return fail(job, "No processor registered for " + job.getJobName());
        }

        Map<String, Object> result;
        try {
            result = processor.get().process(job);
        } catch (NonRetryableJobException e) {
            return fail(job, errorText(e));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (job.getAttempts() >= job.getMaxRetries()) {
                return fail(job, errorText(e));
            }
            return retry(job, message, errorText(e));
        }

        jobStore.completeJob(job.getId(), result);
        jobLogStore.info(job.getId(), "Job completed", meta("attempt", job.getAttempts()));
        log.info("Job {} ({}) completed on attempt {}", job.getId(), job.getJobName(), job.getAttempts());
        return RunOutcome.COMPLETED;
    }

    private RunOutcome retry(Job job, QueueMessage message, String error) {
        jobStore.failJob(job.getId(), error, true);
        long delayMs = backoff.delayMs(job.getAttempts());
        Instant deliverAt = clock.instant().plusMillis(delayMs);
        try {
            source.requeue(message, deliverAt);
        } catch (RuntimeException e) {
            // the claimed message is gone; a failed row stays visible to getRetryableJobs
            log.error("Requeue of job {} failed, marking it failed", job.getId(), e);
            return fail(job, error + " (requeue failed: " + errorText(e) + ")");
        }
        Map<String, Object> metadata = meta("attempt", job.getAttempts());
        metadata.put("retryAt", deliverAt.toString());
        jobLogStore.warn(job.getId(), "Job failed, retry scheduled: " + error, metadata);
        log.warn("Job {} attempt {}/{} failed, retrying in {} ms: {}",
                job.getId(), job.getAttempts(), job.getMaxRetries(), delayMs, error);
        return RunOutcome.RETRYING;
    }

    private RunOutcome fail(Job job, String error) {
        jobStore.failJob(job.getId(), error, false);
        jobLogStore.error(job.getId(), "Job failed permanently: " + error, meta("attempt", job.getAttempts()));
        log.error("Job {} ({}) failed permanently after {} attempts: {}",
                job.getId(), job.getJobName(), job.getAttempts(), error);
        return RunOutcome.FAILED;
    }

    private static String errorText(Exception e) {
        return e.getMessage() == null ? e.getClass().getName() : e.getMessage();
    }

    private static Map<String, Object> meta(String key, Object value) {
        Map<String, Object> m = new HashMap<>();
        m.put(key, value);
        return m;
    }
}
