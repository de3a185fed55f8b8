package com.safee.jobs.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import com.safee.jobs.queue.EnqueueOptions;
import com.safee.jobs.queue.EnqueueResult;
import com.safee.jobs.queue.JobQueues;
import com.safee.jobs.queue.QueueManager;
import com.safee.jobs.store.Job;
import com.safee.jobs.store.JobLog;
import com.safee.jobs.store.JobLogStore;
import com.safee.jobs.store.JobName;
import com.safee.jobs.store.JobPriority;
import com.safee.jobs.store.JobStatus;
import com.safee.jobs.store.JobStore;
import com.safee.jobs.store.JobType;
import com.safee.jobs.store.NewSchedule;
import com.safee.jobs.store.Schedule;
import com.safee.jobs.store.ScheduleStore;
import com.safee.jobs.store.ScheduleUpdate;
import com.zaxxer.hikari.HikariDataSource;

public class JobSchedulerTest {
    private static final String YEARLY = "0 0 1 1 *";

    private HikariDataSource ds;
    private ScheduleStore scheduleStore;
    private JobStore jobStore;
    private JobLogStore jobLogStore;
    private QueueManager queue;
    private ScheduledExecutorService executor;
    private JobScheduler scheduler;

    @Before
    public void setUp() {
        ds = TestDatabases.h2();
        scheduleStore = new ScheduleStore(ds);
        jobStore = new JobStore(ds);
        jobLogStore = new JobLogStore(ds);
        queue = mock(QueueManager.class);
        when(queue.addJobByName(any(), anyMap(), any()))
                .thenAnswer(inv -> new EnqueueResult(JobQueues.queueFor(inv.getArgument(0)), UUID.randomUUID()));
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new JobScheduler(scheduleStore, jobStore, jobLogStore, queue, executor);
    }

    @After
    public void tearDown() {
        scheduler.stop();
        executor.shutdownNow();
        ds.close();
    }

    private Schedule schedule(String name, String cron, boolean active) {
        return scheduleStore.createSchedule(NewSchedule.of(name, JobName.GENERATE_REPORT)
                .cronExpression(cron)
                .active(active)
                .priority(JobPriority.HIGH)
                .organizationId("org-7")
                .payload(Map.of("report", "monthly")));
    }

    @Test
    public void startRegistersActiveCronSchedulesOnly() {
        Schedule active = schedule("active", YEARLY, true);
        Schedule inactive = schedule("inactive", YEARLY, false);
        Schedule manual = schedule("manual", null, true);

        scheduler.start();

        assertThat(scheduler.getState(), is(SchedulerState.RUNNING));
        assertThat(scheduler.isScheduled(active.getId()), is(true));
        assertThat(scheduler.isScheduled(inactive.getId()), is(false));
        assertThat(scheduler.isScheduled(manual.getId()), is(false));
        assertThat(scheduleStore.getScheduleById(active.getId()).orElseThrow().getNextRunAt(), notNullValue());
        assertThat(scheduler.nextFireTime(active.getId()).isPresent(), is(true));
    }

    @Test
    public void invalidCronLeavesNoTriggerAndOthersStillLoad() {
        Schedule broken = schedule("broken", "not a cron", true);
        Schedule good = schedule("good", YEARLY, true);

        scheduler.start();

        assertThat(scheduler.isScheduled(broken.getId()), is(false));
        assertThat(scheduler.isScheduled(good.getId()), is(true));
    }

    @Test
    public void startAndStopAreIdempotent() {
        Schedule s = schedule("s", YEARLY, true);
        scheduler.start();
        scheduler.start();
        assertThat(scheduler.scheduledIds(), hasSize(1));

        scheduler.stop();
        scheduler.stop();
        assertThat(scheduler.getState(), is(SchedulerState.STOPPED));
        assertThat(scheduler.isScheduled(s.getId()), is(false));
    }

    @Test
    public void scheduleJobWhileStoppedRegistersNothing() {
        Schedule s = schedule("s", YEARLY, true);
        scheduler.scheduleJob(s.getId());
        assertThat(scheduler.scheduledIds(), is(empty()));
    }

    @Test
    public void rescheduleFollowsTheStoredState() {
        Schedule s = schedule("s", YEARLY, true);
        scheduler.start();

        scheduleStore.updateSchedule(s.getId(), ScheduleUpdate.none().active(false));
        scheduler.scheduleJob(s.getId());
        assertThat(scheduler.isScheduled(s.getId()), is(false));

        scheduleStore.updateSchedule(s.getId(), ScheduleUpdate.none().active(true));
        scheduler.scheduleJob(s.getId());
        assertThat(scheduler.isScheduled(s.getId()), is(true));

        scheduler.unscheduleJob(s.getId());
        assertThat(scheduler.isScheduled(s.getId()), is(false));
    }

    @Test
    public void scheduleJobForMissingScheduleIsANoOp() {
        scheduler.start();
        scheduler.scheduleJob(UUID.randomUUID());
        assertThat(scheduler.scheduledIds(), is(empty()));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void fireCreatesCronJobQueuesItAndLogs() {
        Schedule s = schedule("monthly-report", YEARLY, true);
        scheduler.start();
        Instant fire = Instant.parse("2031-01-01T00:00:00Z");

        scheduler.executeCronJob(s.getId(), fire);

        List<Job> jobs = jobStore.getJobsByStatus(JobStatus.PENDING);
        assertThat(jobs, hasSize(1));
        Job job = jobs.get(0);
        assertThat(job.getType(), is(JobType.CRON));
        assertThat(job.getJobName(), is(JobName.GENERATE_REPORT));
        assertThat(job.getPriority(), is(JobPriority.HIGH));
        assertThat(job.getScheduleId(), is(s.getId()));
        assertThat(job.getScheduledFor(), is(fire));
        assertThat(job.getOrganizationId(), is("org-7"));
        assertThat(job.getPayload(), is(Map.<String, Object>of("report", "monthly")));

        Schedule after = scheduleStore.getScheduleById(s.getId()).orElseThrow();
        assertThat(after.getLastRunAt(), is(fire));
        assertThat(after.getNextRunAt(), is(Instant.parse("2032-01-01T00:00:00Z")));

        ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<EnqueueOptions> options = ArgumentCaptor.forClass(EnqueueOptions.class);
        verify(queue).addJobByName(eq(JobName.GENERATE_REPORT), data.capture(), options.capture());
        assertThat(data.getValue().get("jobId"), is((Object) job.getId().toString()));
        assertThat(options.getValue().getPriority(), is(JobPriority.HIGH));

        List<JobLog> logs = jobLogStore.getJobLogs(job.getId());
        assertThat(logs, hasSize(1));
        assertThat(logs.get(0).getMessage(), is("Job created by schedule"));
        assertThat(logs.get(0).getMetadata().get("scheduleId"), is((Object) s.getId().toString()));
        assertThat(logs.get(0).getMetadata().get("queueName"), is((Object) "reports"));
    }

    @Test
    public void refusedFireGuardCreatesNoJob() {
        JobScheduler guarded = new JobScheduler(scheduleStore, jobStore, jobLogStore, queue, executor,
                Clock.systemUTC(), (id, t) -> false);
        Schedule s = schedule("s", YEARLY, true);

        guarded.executeCronJob(s.getId(), Instant.parse("2031-01-01T00:00:00Z"));

        assertThat(jobStore.getJobsByStatus(JobStatus.values()), is(empty()));
        assertThat(scheduleStore.getScheduleById(s.getId()).orElseThrow().getLastRunAt(), nullValue());
        verify(queue, never()).addJobByName(any(), anyMap(), any());
    }

    @Test
    public void fireOfDeletedScheduleUnschedules() {
        Schedule s = schedule("s", YEARLY, true);
        scheduler.start();
        scheduleStore.deleteSchedule(s.getId());

        scheduler.executeCronJob(s.getId(), Instant.parse("2031-01-01T00:00:00Z"));

        assertThat(scheduler.isScheduled(s.getId()), is(false));
        assertThat(jobStore.getJobsByStatus(JobStatus.values()), is(empty()));
    }

    @Test
    public void queueErrorIsContained() {
        doThrow(new IllegalStateException("queue down")).when(queue).addJobByName(any(), anyMap(), any());
        Schedule s = schedule("s", YEARLY, true);
        scheduler.start();

        scheduler.executeCronJob(s.getId(), Instant.parse("2031-01-01T00:00:00Z"));

        assertThat(scheduler.isScheduled(s.getId()), is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void queueJobRejectsNonUuid() {
        scheduler.queueJob("42", JobName.SEND_EMAIL, EnqueueOptions.defaults());
    }

    @Test
    public void queueJobForwardsIdOnly() {
        String id = UUID.randomUUID().toString();
        EnqueueResult r = scheduler.queueJob(id, JobName.SEND_EMAIL, null);

        assertThat(r.getQueueName(), is(JobQueues.queueFor(JobName.SEND_EMAIL)));
        verify(queue).addJobByName(eq(JobName.SEND_EMAIL), eq(Map.<String, Object>of("jobId", id)), any());
    }
}
