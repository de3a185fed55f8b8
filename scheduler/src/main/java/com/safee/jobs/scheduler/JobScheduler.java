package com.safee.jobs.scheduler;

import com.cronutils.model.Cron;
import com.safee.jobs.queue.EnqueueOptions;
import com.safee.jobs.queue.EnqueueResult;
import com.safee.jobs.queue.QueueManager;
import com.safee.jobs.queue.QueueMessage;
import com.safee.jobs.store.Job;
import com.safee.jobs.store.JobLogStore;
import com.safee.jobs.store.JobName;
import com.safee.jobs.store.JobStore;
import com.safee.jobs.store.JobType;
import com.safee.jobs.store.NewJob;
import com.safee.jobs.store.Schedule;
import com.safee.jobs.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.regex.Pattern;

/**
 * Turns persisted cron schedules into jobs.
 * Implements:
 * - start / stop : load every active cron schedule, or cancel every trigger
 * - scheduleJob(id) : (re)register the trigger of one schedule, cancel-then-register
 * - unscheduleJob(id) : drop one trigger
 * - queueJob(jobId, jobName, options) : hand an existing job row to the queue manager
 *
 * Each fire creates a {@code cron} job, records the run on the schedule, queues the job and
 * writes a job log line. Errors around one schedule are logged and never reach the others.
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final ScheduleStore scheduleStore;
    private final JobStore jobStore;
    private final JobLogStore jobLogStore;
    private final QueueManager queueManager;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final FireGuard fireGuard;

    private final Map<UUID, CronTrigger> triggers = new ConcurrentHashMap<>();
    private final Object triggerLock = new Object();
    private volatile SchedulerState state = SchedulerState.STOPPED;

    public JobScheduler(ScheduleStore scheduleStore, JobStore jobStore, JobLogStore jobLogStore,
                        QueueManager queueManager, ScheduledExecutorService executor) {
        this(scheduleStore, jobStore, jobLogStore, queueManager, executor, Clock.systemUTC(), FireGuard.always());
    }

    public JobScheduler(ScheduleStore scheduleStore, JobStore jobStore, JobLogStore jobLogStore,
                        QueueManager queueManager, ScheduledExecutorService executor, Clock clock,
                        FireGuard fireGuard) {
        this.scheduleStore = scheduleStore;
        this.jobStore = jobStore;
        this.jobLogStore = jobLogStore;
        this.queueManager = queueManager;
        this.executor = executor;
        this.clock = clock;
        this.fireGuard = fireGuard == null ? FireGuard.always() : fireGuard;
    }

    public void start() {
        synchronized (triggerLock) {
            if (state == SchedulerState.RUNNING) {
                log.info("Job scheduler is already running");
                return;
            }
            state = SchedulerState.RUNNING;
        }
        log.info("Starting job scheduler");
        List<Schedule> schedules = scheduleStore.listSchedulesToLoad();
        for (Schedule schedule : schedules) {
            try {
                scheduleJob(schedule.getId());
            } catch (RuntimeException e) {
                log.error("Failed to load schedule {}", schedule.getId(), e);
            }
        }
        log.info("Job scheduler started with {} active schedules", triggers.size());
    }

    public void stop() {
        synchronized (triggerLock) {
            if (state == SchedulerState.STOPPED) {
                return;
            }
            for (CronTrigger trigger : triggers.values()) {
                trigger.cancel();
            }
            int cancelled = triggers.size();
            triggers.clear();
            state = SchedulerState.STOPPED;
            log.info("Job scheduler stopped ({} triggers cancelled)", cancelled);
        }
    }

    /**
     * Registers (or replaces) the trigger of one schedule. A missing or inactive schedule, or one
     * without a usable cron expression, is logged and leaves no trigger behind.
     */
    public void scheduleJob(UUID scheduleId) {
        Optional<Schedule> found = scheduleStore.getScheduleById(scheduleId);
        if (found.isEmpty()) {
            log.warn("Schedule {} not found, nothing scheduled", scheduleId);
            unscheduleJob(scheduleId);
            return;
        }
        Schedule schedule = found.get();
        if (!schedule.isActive() || schedule.getCronExpression() == null) {
            log.info("Schedule {} is inactive or has no cron expression, nothing scheduled", scheduleId);
            unscheduleJob(scheduleId);
            return;
        }

        Cron cron;
        ZoneId zone;
        try {
            cron = CronExpressions.parse(schedule.getCronExpression());
            zone = CronExpressions.zone(schedule.getTimezone());
        } catch (IllegalArgumentException e) {
            log.error("Schedule {} has an invalid cron setup: {}", scheduleId, e.getMessage());
            unscheduleJob(scheduleId);
            return;
        }

        Optional<Instant> next;
        synchronized (triggerLock) {
            if (state != SchedulerState.RUNNING) {
                log.info("Job scheduler is stopped, schedule {} not registered", scheduleId);
                return;
            }
            CronTrigger previous = triggers.remove(scheduleId);
            if (previous != null) {
                previous.cancel();
            }
            CronTrigger trigger = new CronTrigger(scheduleId, cron, zone, executor, clock,
                    fireTime -> executeCronJob(scheduleId, fireTime));
            next = trigger.start();
            if (next.isPresent()) {
                triggers.put(scheduleId, trigger);
            }
        }
        if (next.isPresent()) {
            scheduleStore.updateNextRunAt(scheduleId, next.get());
            log.info("Scheduled job {} ({}) cron '{}' tz {} next run {}",
                    schedule.getName(), schedule.getJobName(), schedule.getCronExpression(), zone, next.get());
        }
    }

    public void unscheduleJob(UUID scheduleId) {
        synchronized (triggerLock) {
            CronTrigger trigger = triggers.remove(scheduleId);
            if (trigger != null) {
                trigger.cancel();
                log.info("Unscheduled schedule {}", scheduleId);
            }
        }
    }

    /**
     * Forwards an existing job to the queue manager with {@code {jobId}} as data.
     * The returned queue identifiers are not stored.
     *
     * @throws IllegalArgumentException when {@code jobId} is not a UUID
     */
    public EnqueueResult queueJob(String jobId, JobName jobName, EnqueueOptions options) {
        if (jobId == null || !UUID_PATTERN.matcher(jobId).matches()) {
            throw new IllegalArgumentException("Invalid job id, expected a UUID: " + jobId);
        }
        if (jobName == null) {
            throw new IllegalArgumentException("jobName is required");
        }
        Map<String, Object> data = new HashMap<>();
        data.put(QueueMessage.JOB_ID, jobId);
        EnqueueResult result = queueManager.addJobByName(jobName, data,
                options == null ? EnqueueOptions.defaults() : options);
        log.info("Job {} queued on {} as message {}", jobId, result.getQueueName(), result.getMessageId());
        return result;
    }

    /**
     * One fire of a schedule's trigger. Package-private so tests can fire without waiting.
     */
    void executeCronJob(UUID scheduleId, Instant fireTime) {
        try {
            Optional<Schedule> found = scheduleStore.getScheduleById(scheduleId);
            if (found.isEmpty() || !found.get().isActive()) {
                log.warn("Schedule {} is gone or inactive at fire time {}, unscheduling", scheduleId, fireTime);
                unscheduleJob(scheduleId);
                return;
            }
            Schedule schedule = found.get();
            if (!fireGuard.tryClaim(scheduleId, fireTime)) {
                log.debug("Fire {} of schedule {} claimed elsewhere, skipping", fireTime, scheduleId);
                return;
            }

            log.info("Executing cron job for schedule {} ({})", schedule.getName(), scheduleId);
            Job job = jobStore.createJob(NewJob.of(schedule.getJobName())
                    .type(JobType.CRON)
                    .priority(schedule.getPriority())
                    .payload(schedule.getPayload())
                    .organizationId(schedule.getOrganizationId())
                    .scheduleId(scheduleId)
                    .scheduledFor(fireTime));

            CronTrigger trigger = triggers.get(scheduleId);
            Instant nextRun = trigger == null ? null : trigger.nextAfter(fireTime).orElse(null);
            scheduleStore.updateScheduleRunTime(scheduleId, fireTime, nextRun);

            EnqueueResult queued = queueJob(job.getId().toString(), job.getJobName(), EnqueueOptions.defaults()
                    .priority(job.getPriority())
                    .organizationId(job.getOrganizationId()));

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("scheduleId", scheduleId.toString());
            metadata.put("scheduleName", schedule.getName());
            metadata.put("queueName", queued.getQueueName());
            metadata.put("messageId", queued.getMessageId().toString());
            jobLogStore.info(job.getId(), "Job created by schedule", metadata);
            log.info("Cron job {} created for schedule {}", job.getId(), scheduleId);
        } catch (RuntimeException e) {
            log.error("Failed to execute cron job for schedule {}", scheduleId, e);
        }
    }

    public boolean isScheduled(UUID scheduleId) {
        return triggers.containsKey(scheduleId);
    }

    public Set<UUID> scheduledIds() {
        return new TreeSet<>(triggers.keySet());
    }

    public SchedulerState getState() {
        return state;
    }

    /** Next fire of a registered trigger, empty when the schedule has none. */
    public Optional<Instant> nextFireTime(UUID scheduleId) {
        CronTrigger trigger = triggers.get(scheduleId);
        return trigger == null ? Optional.empty() : Optional.ofNullable(trigger.getNextFireTime());
    }
}
