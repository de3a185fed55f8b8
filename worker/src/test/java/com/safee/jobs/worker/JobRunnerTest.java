package com.safee.jobs.worker;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.safee.jobs.queue.JobQueues;
import com.safee.jobs.queue.MessageSource;
import com.safee.jobs.queue.QueueMessage;
import com.safee.jobs.store.Job;
import com.safee.jobs.store.JobLog;
import com.safee.jobs.store.JobLogStore;
import com.safee.jobs.store.JobName;
import com.safee.jobs.store.JobStatus;
import com.safee.jobs.store.JobStore;
import com.safee.jobs.store.NewJob;
import com.safee.jobs.worker.metrics.PromWorkerMetrics;
import com.zaxxer.hikari.HikariDataSource;

import io.prometheus.client.CollectorRegistry;

public class JobRunnerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private HikariDataSource ds;
    private JobStore jobStore;
    private JobLogStore jobLogStore;
    private MessageSource source;
    private JobProcessorRegistry processors;
    private final List<RunOutcome> finished = new ArrayList<>();
    private JobRunner runner;

    @Before
    public void setUp() {
        ds = TestDatabases.h2();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        jobStore = new JobStore(ds, clock);
        jobLogStore = new JobLogStore(ds, clock);
        source = mock(MessageSource.class);
        processors = new JobProcessorRegistry();
        WorkerMetrics recording = new WorkerMetrics() {
            @Override
            public void jobFinished(RunOutcome outcome, double durationSeconds) {
                finished.add(outcome);
            }
        };
        runner = new JobRunner(jobStore, jobLogStore, processors, source,
                new RetryBackoff(5_000, 60_000, () -> 0.5), recording, clock);
    }

    @After
    public void tearDown() {
        ds.close();
    }

    private interface Body {
        Map<String, Object> process(Job job) throws Exception;
    }

    private void register(JobName name, Body body) {
        processors.register(new JobProcessor() {
            @Override
            public JobName jobName() {
                return name;
            }

            @Override
            public Map<String, Object> process(Job job) throws Exception {
                return body.process(job);
            }
        });
    }

    private static QueueMessage messageFor(Job job) {
        return new QueueMessage(JobQueues.queueFor(job.getJobName()), 0, NOW, UUID.randomUUID(), job.getJobName(),
                job.getPriority(), null, Map.of(QueueMessage.JOB_ID, job.getId().toString()), 1);
    }

    @Test
    public void successCompletesWithResult() {
        register(JobName.SEND_EMAIL, job -> Map.of("sent", true));
        Job job = jobStore.createJob(NewJob.of(JobName.SEND_EMAIL));

        assertThat(runner.run(messageFor(job)), is(RunOutcome.COMPLETED));

        Job after = jobStore.getJobById(job.getId()).orElseThrow();
        assertThat(after.getStatus(), is(JobStatus.COMPLETED));
        assertThat(after.getResult(), is(Map.<String, Object>of("sent", true)));
        assertThat(after.getAttempts(), is(1));
        assertThat(after.getStartedAt(), is(NOW));
        assertThat(after.getCompletedAt(), is(NOW));
        assertThat(finished, is(List.of(RunOutcome.COMPLETED)));

        List<JobLog> logs = jobLogStore.getJobLogs(job.getId());
        assertThat(logs.size(), is(2));
        verify(source, never()).requeue(any(), any());
    }

    @Test
    public void failureWithAttemptsLeftRetriesWithBackoff() {
        register(JobName.SYNC_ODOO, job -> {
            throw new IllegalStateException("erp unavailable");
        });
        Job job = jobStore.createJob(NewJob.of(JobName.SYNC_ODOO).maxRetries(3));
        QueueMessage message = messageFor(job);

        assertThat(runner.run(message), is(RunOutcome.RETRYING));

        Job after = jobStore.getJobById(job.getId()).orElseThrow();
        assertThat(after.getStatus(), is(JobStatus.RETRYING));
        assertThat(after.getError(), is("erp unavailable"));
        assertThat(after.getCompletedAt(), nullValue());
        verify(source).requeue(message, NOW.plusMillis(5_000));
        assertThat(jobLogStore.getJobLogs(job.getId()).stream()
                .anyMatch(l -> l.getMessage().contains("retry scheduled")), is(true));
    }

    @Test
    public void lastAllowedAttemptFailsPermanently() {
        register(JobName.SYNC_ODOO, job -> {
            throw new IllegalStateException("still down");
        });
        Job job = jobStore.createJob(NewJob.of(JobName.SYNC_ODOO).maxRetries(2));

        assertThat(runner.run(messageFor(job)), is(RunOutcome.RETRYING));
        assertThat(runner.run(messageFor(job)), is(RunOutcome.FAILED));

        Job after = jobStore.getJobById(job.getId()).orElseThrow();
        assertThat(after.getStatus(), is(JobStatus.FAILED));
        assertThat(after.getAttempts(), is(2));
        assertThat(after.getCompletedAt(), notNullValue());
        assertThat(jobLogStore.getJobErrorLogs(job.getId()).size(), is(2));
    }

    @Test
    public void retryThenSucceed() {
        AtomicInteger calls = new AtomicInteger();
        register(JobName.GENERATE_REPORT, job -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("flaky");
            }
            return null;
        });
        Job job = jobStore.createJob(NewJob.of(JobName.GENERATE_REPORT));

        runner.run(messageFor(job));
        assertThat(runner.run(messageFor(job)), is(RunOutcome.COMPLETED));

        Job after = jobStore.getJobById(job.getId()).orElseThrow();
        assertThat(after.getStatus(), is(JobStatus.COMPLETED));
        assertThat(after.getAttempts(), is(2));
    }

    @Test
    public void nonRetryableFailsOnFirstAttempt() {
        register(JobName.ENCRYPT_FILE, job -> {
            throw new NonRetryableJobException("file missing");
        });
        Job job = jobStore.createJob(NewJob.of(JobName.ENCRYPT_FILE).maxRetries(5));

        assertThat(runner.run(messageFor(job)), is(RunOutcome.FAILED));
        assertThat(jobStore.getJobById(job.getId()).orElseThrow().getError(), is("file missing"));
        verify(source, never()).requeue(any(), any());
    }

    @Test
    public void missingProcessorFailsWithoutRetry() {
        Job job = jobStore.createJob(NewJob.of(JobName.ROTATE_ENCRYPTION_KEY));

        assertThat(runner.run(messageFor(job)), is(RunOutcome.FAILED));
        Job after = jobStore.getJobById(job.getId()).orElseThrow();
        assertThat(after.getStatus(), is(JobStatus.FAILED));
        assertThat(after.getError(), containsString("No processor registered for rotate_encryption_key"));
    }

    @Test
    public void cancelledJobIsNeverStarted() {
        AtomicInteger calls = new AtomicInteger();
        register(JobName.SEND_EMAIL, job -> {
            calls.incrementAndGet();
            return null;
        });
        Job job = jobStore.createJob(NewJob.of(JobName.SEND_EMAIL));
        jobStore.cancelJob(job.getId());

        assertThat(runner.run(messageFor(job)), is(RunOutcome.SKIPPED));

        Job after = jobStore.getJobById(job.getId()).orElseThrow();
        assertThat(after.getStatus(), is(JobStatus.CANCELLED));
        assertThat(after.getAttempts(), is(0));
        assertThat(after.getStartedAt(), nullValue());
        assertThat(calls.get(), is(0));
        assertThat(finished.isEmpty(), is(true));
    }

    @Test
    public void jobCancelledBetweenReadAndStartIsSkipped() {
        AtomicInteger calls = new AtomicInteger();
        register(JobName.SEND_EMAIL, job -> {
            calls.incrementAndGet();
            return Map.of();
        });
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        JobStore cancellingOnRead = new JobStore(ds, clock) {
            @Override
            public Optional<Job> getJobById(UUID id) {
                Optional<Job> found = super.getJobById(id);
                cancelJob(id);
                return found;
            }
        };
        JobRunner racing = new JobRunner(cancellingOnRead, jobLogStore, processors, source,
                RetryBackoff.defaults(), WorkerMetrics.NOOP, clock);
        Job job = jobStore.createJob(NewJob.of(JobName.SEND_EMAIL));

        assertThat(racing.run(messageFor(job)), is(RunOutcome.SKIPPED));

        Job after = jobStore.getJobById(job.getId()).orElseThrow();
        assertThat(after.getStatus(), is(JobStatus.CANCELLED));
        assertThat(after.getAttempts(), is(0));
        assertThat(calls.get(), is(0));
    }

    @Test
    public void failedRequeueLeavesJobFailedAndRetryable() {
        register(JobName.SYNC_ODOO, job -> {
            throw new IllegalStateException("erp unavailable");
        });
        doThrow(new IllegalStateException("cassandra down")).when(source).requeue(any(), any());
        Job job = jobStore.createJob(NewJob.of(JobName.SYNC_ODOO).maxRetries(3));

        assertThat(runner.run(messageFor(job)), is(RunOutcome.FAILED));

        Job after = jobStore.getJobById(job.getId()).orElseThrow();
        assertThat(after.getStatus(), is(JobStatus.FAILED));
        assertThat(after.getCompletedAt(), is(NOW));
        assertThat(after.getError(), containsString("cassandra down"));
        assertThat(jobStore.getRetryableJobs(10).stream()
                .anyMatch(j -> j.getId().equals(job.getId())), is(true));
    }

    @Test
    public void messageForUnknownJobIsDropped() {
        QueueMessage orphan = new QueueMessage("email", 0, NOW, UUID.randomUUID(), JobName.SEND_BULK_EMAIL,
                null, null, Map.of(QueueMessage.JOB_ID, UUID.randomUUID().toString()), 1);
        QueueMessage noId = new QueueMessage("email", 0, NOW, UUID.randomUUID(), JobName.SEND_BULK_EMAIL,
                null, null, Map.of(), 1);

        assertThat(runner.run(orphan), is(RunOutcome.DROPPED));
        assertThat(runner.run(noId), is(RunOutcome.DROPPED));
    }

    @Test
    public void prometheusMetricsCountOutcomes() {
        CollectorRegistry registry = new CollectorRegistry();
        JobRunner instrumented = new JobRunner(jobStore, jobLogStore, processors, source,
                RetryBackoff.defaults(), new PromWorkerMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
        register(JobName.SEND_EMAIL, job -> null);
        Job ok = jobStore.createJob(NewJob.of(JobName.SEND_EMAIL));
        Job orphan = jobStore.createJob(NewJob.of(JobName.INSTALL_ODOO_MODULES));

        instrumented.run(messageFor(ok));
        instrumented.run(messageFor(orphan));

        assertThat(registry.getSampleValue("jobs_processed_total", new String[]{"status"}, new String[]{"completed"}),
                is(1.0));
        assertThat(registry.getSampleValue("jobs_processed_total", new String[]{"status"}, new String[]{"failed"}),
                is(1.0));
        assertThat(registry.getSampleValue("jobs_failed_permanently_total"), is(1.0));
        assertThat(registry.getSampleValue("jobs_in_progress"), is(0.0));
    }
}
