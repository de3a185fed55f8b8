package com.safee.jobs.scheduler.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safee.jobs.scheduler.CronExpressions;
import com.safee.jobs.scheduler.JobScheduler;
import com.safee.jobs.scheduler.metrics.SchedulerMetrics;
import com.safee.jobs.store.JobName;
import com.safee.jobs.store.JobPriority;
import com.safee.jobs.store.NewSchedule;
import com.safee.jobs.store.Schedule;
import com.safee.jobs.store.ScheduleNotFoundException;
import com.safee.jobs.store.ScheduleStore;
import com.safee.jobs.store.ScheduleUpdate;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.UUID;

/**
 * /schedules resource. Every write re-syncs the in-process trigger of the schedule it touched.
 */
class SchedulesHandler extends JsonHandler {
    private final ScheduleStore scheduleStore;
    private final JobScheduler scheduler;

    SchedulesHandler(ScheduleStore scheduleStore, JobScheduler scheduler, ObjectMapper mapper,
                     SchedulerMetrics metrics) {
        super(mapper, metrics);
        this.scheduleStore = scheduleStore;
        this.scheduler = scheduler;
    }

    @Override
    protected void route(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() <= "/schedules".length() ? "" : path.substring("/schedules".length());
        rest = rest.replaceAll("^/+", "").replaceAll("/+$", "");

        if (rest.isEmpty()) {
            if (is(exchange, "POST")) {
                create(exchange);
            } else if (is(exchange, "GET")) {
                respondJson(exchange, 200, scheduleStore.listSchedules());
            } else {
                methodNotAllowed(exchange);
            }
            return;
        }
        if (rest.contains("/")) {
            respondJson(exchange, 404, new ErrorResponse("not_found", "no route for " + path));
            return;
        }

        UUID id = parseId(rest, "schedule");
        if (is(exchange, "GET")) {
            respondJson(exchange, 200, load(id));
        } else if (is(exchange, "PUT")) {
            update(exchange, id);
        } else if (is(exchange, "DELETE")) {
            scheduler.unscheduleJob(id);
            if (!scheduleStore.deleteSchedule(id)) {
                throw new ScheduleNotFoundException(id);
            }
            respondNoContent(exchange);
        } else {
            methodNotAllowed(exchange);
        }
    }

    private void create(HttpExchange exchange) throws IOException {
        ScheduleRequest req = readBody(exchange, ScheduleRequest.class);
        if (req.getJobName() == null) {
            throw new IllegalArgumentException("jobName is required");
        }
        validateCron(req.getCronExpression());
        NewSchedule data = NewSchedule.of(req.getName(), JobName.fromValue(req.getJobName()))
                .description(req.getDescription())
                .cronExpression(req.getCronExpression())
                .timezone(req.getTimezone())
                .payload(req.getPayload())
                .organizationId(req.getOrganizationId());
        if (req.getActive() != null) {
            data.active(req.getActive());
        }
        if (req.getPriority() != null) {
            data.priority(JobPriority.fromValue(req.getPriority()));
        }
        Schedule created = scheduleStore.createSchedule(data);
        scheduler.scheduleJob(created.getId());
        respondJson(exchange, 201, load(created.getId()));
    }

    private void update(HttpExchange exchange, UUID id) throws IOException {
        ScheduleRequest req = readBody(exchange, ScheduleRequest.class);
        if (req.getJobName() != null) {
            throw new IllegalArgumentException("jobName of a schedule cannot be changed");
        }
        ScheduleUpdate update = ScheduleUpdate.none();
        if (req.getName() != null) {
            update.name(req.getName());
        }
        if (req.hasDescription()) {
            update.description(req.getDescription());
        }
        if (req.hasCronExpression()) {
            validateCron(req.getCronExpression());
            update.cronExpression(req.getCronExpression());
        }
        if (req.getTimezone() != null) {
            update.timezone(req.getTimezone());
        }
        if (req.getActive() != null) {
            update.active(req.getActive());
        }
        if (req.hasPayload()) {
            update.payload(req.getPayload());
        }
        if (req.getPriority() != null) {
            update.priority(JobPriority.fromValue(req.getPriority()));
        }
        scheduleStore.updateSchedule(id, update);
        scheduler.scheduleJob(id);
        respondJson(exchange, 200, load(id));
    }

    private Schedule load(UUID id) {
        return scheduleStore.getScheduleById(id).orElseThrow(() -> new ScheduleNotFoundException(id));
    }

    private static void validateCron(String expression) {
        if (expression != null) {
            CronExpressions.parse(expression);
        }
    }
}
