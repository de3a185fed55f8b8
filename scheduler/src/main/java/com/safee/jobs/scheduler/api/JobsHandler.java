package com.safee.jobs.scheduler.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safee.jobs.queue.EnqueuedJob;
import com.safee.jobs.queue.JobDispatcher;
import com.safee.jobs.scheduler.metrics.SchedulerMetrics;
import com.safee.jobs.store.Job;
import com.safee.jobs.store.JobLogStore;
import com.safee.jobs.store.JobName;
import com.safee.jobs.store.JobNotFoundException;
import com.safee.jobs.store.JobPriority;
import com.safee.jobs.store.JobStatus;
import com.safee.jobs.store.JobStore;
import com.safee.jobs.store.JobType;
import com.safee.jobs.store.NewJob;
import com.safee.jobs.store.TimeRange;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * /jobs resource:
 * POST /jobs, GET /jobs?status=a,b, GET /jobs/stats, GET /jobs/{id}, GET /jobs/{id}/logs,
 * POST /jobs/{id}/cancel.
 */
class JobsHandler extends JsonHandler {
    private static final int DEFAULT_LIST_LIMIT = 100;

    private final JobStore jobStore;
    private final JobLogStore jobLogStore;
    private final JobDispatcher dispatcher;
    private final Clock clock;

    JobsHandler(JobStore jobStore, JobLogStore jobLogStore, JobDispatcher dispatcher, Clock clock,
                ObjectMapper mapper, SchedulerMetrics metrics) {
        super(mapper, metrics);
        this.jobStore = jobStore;
        this.jobLogStore = jobLogStore;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    protected void route(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String remainder = path.length() <= "/jobs".length() ? "" : path.substring("/jobs".length());
        if (remainder.startsWith("/")) {
            remainder = remainder.substring(1);
        }
        if (remainder.endsWith("/")) {
            remainder = remainder.substring(0, remainder.length() - 1);
        }

        if (remainder.isEmpty()) {
            if (is(exchange, "POST")) {
                create(exchange);
            } else if (is(exchange, "GET")) {
                list(exchange);
            } else {
                methodNotAllowed(exchange);
            }
            return;
        }
        if ("stats".equals(remainder)) {
            if (!is(exchange, "GET")) {
                methodNotAllowed(exchange);
                return;
            }
            stats(exchange);
            return;
        }

        String[] parts = remainder.split("/");
        UUID id = parseId(parts[0], "job");
        if (parts.length == 1) {
            if (!is(exchange, "GET")) {
                methodNotAllowed(exchange);
                return;
            }
            Job job = jobStore.getJobById(id).orElseThrow(() -> new JobNotFoundException(id));
            respondJson(exchange, 200, job);
        } else if (parts.length == 2 && "logs".equals(parts[1])) {
            if (!is(exchange, "GET")) {
                methodNotAllowed(exchange);
                return;
            }
            if (jobStore.getJobById(id).isEmpty()) {
                throw new JobNotFoundException(id);
            }
            respondJson(exchange, 200, jobLogStore.getJobLogs(id));
        } else if (parts.length == 2 && "cancel".equals(parts[1])) {
            if (!is(exchange, "POST")) {
                methodNotAllowed(exchange);
                return;
            }
            respondJson(exchange, 200, jobStore.cancelJob(id));
        } else {
            respondJson(exchange, 404, new ErrorResponse("not_found", "no route for " + path));
        }
    }

    private void create(HttpExchange exchange) throws IOException {
        JobCreateRequest req = readBody(exchange, JobCreateRequest.class);
        if (req.getJobName() == null) {
            throw new IllegalArgumentException("jobName is required");
        }
        Instant scheduledFor = resolveScheduledTime(req);
        JobType type;
        if (req.getType() != null) {
            type = JobType.fromValue(req.getType());
        } else {
            type = scheduledFor == null ? JobType.IMMEDIATE : JobType.SCHEDULED;
        }
        NewJob data = NewJob.of(JobName.fromValue(req.getJobName()))
                .type(type)
                .payload(req.getPayload())
                .scheduledFor(scheduledFor)
                .organizationId(req.getOrganizationId());
        if (req.getPriority() != null) {
            data.priority(JobPriority.fromValue(req.getPriority()));
        }
        if (req.getMaxRetries() != null) {
            data.maxRetries(req.getMaxRetries());
        }
        EnqueuedJob enqueued = dispatcher.enqueue(data);
        respondJson(exchange, 201, new EnqueueResponse(enqueued.getJob(),
                enqueued.getEnqueueResult().getQueueName(),
                enqueued.getEnqueueResult().getMessageId().toString()));
    }

    private void list(HttpExchange exchange) throws IOException {
        String raw = query(exchange).get("status");
        List<JobStatus> statuses = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            statuses.addAll(EnumSet.allOf(JobStatus.class));
        } else {
            for (String s : raw.split(",")) {
                statuses.add(JobStatus.fromValue(s.trim()));
            }
        }
        List<Job> jobs = jobStore.getJobsByStatus(statuses);
        respondJson(exchange, 200, jobs.size() > DEFAULT_LIST_LIMIT ? jobs.subList(0, DEFAULT_LIST_LIMIT) : jobs);
    }

    private void stats(HttpExchange exchange) throws IOException {
        Map<String, String> q = query(exchange);
        String from = q.get("from");
        String to = q.get("to");
        TimeRange range = null;
        if (from != null || to != null) {
            range = new TimeRange(
                    from == null ? Instant.EPOCH : parseInstant("from", from),
                    to == null ? clock.instant() : parseInstant("to", to));
        }
        respondJson(exchange, 200, new JobStatsResponse(jobStore.getJobStats(q.get("organizationId"), range)));
    }

    private Instant resolveScheduledTime(JobCreateRequest req) {
        if (req.getRunAt() != null && !req.getRunAt().trim().isEmpty()) {
            return parseInstant("runAt", req.getRunAt().trim());
        }
        if (req.getDelaySeconds() != null) {
            if (req.getDelaySeconds() < 0) {
                throw new IllegalArgumentException("delaySeconds must be >= 0");
            }
            return clock.instant().plusSeconds(req.getDelaySeconds());
        }
        return null;
    }

    private static Instant parseInstant(String field, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException(field + " must be ISO-8601 Instant, got: " + value);
        }
    }
}
