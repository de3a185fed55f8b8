package com.safee.jobs.scheduler.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * HTTP and trigger metrics of the scheduler process.
 */
public class SchedulerMetrics {
    private final Counter httpRequests;
    private final Gauge activeTriggers;

    public SchedulerMetrics(CollectorRegistry registry) {
        this.httpRequests = Counter.build()
                .name("scheduler_http_requests_total")
                .help("Scheduler HTTP requests")
                .labelNames("path", "method", "status")
                .register(registry);
        this.activeTriggers = Gauge.build()
                .name("scheduler_active_triggers")
                .help("Cron triggers currently registered")
                .register(registry);
    }

    public void observeRequest(String path, String method, int status) {
        httpRequests.labels(path, method, String.valueOf(status)).inc();
    }

    public void setActiveTriggers(int count) {
        activeTriggers.set(count);
    }
}
