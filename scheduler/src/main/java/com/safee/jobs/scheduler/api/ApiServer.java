package com.safee.jobs.scheduler.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.safee.jobs.queue.JobDispatcher;
import com.safee.jobs.scheduler.JobScheduler;
import com.safee.jobs.scheduler.metrics.SchedulerMetrics;
import com.safee.jobs.store.JobLogStore;
import com.safee.jobs.store.JobStore;
import com.safee.jobs.store.ScheduleStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

/**
 * HTTP surface of the scheduler process: /jobs, /schedules, /healthz, /readyz and /metrics.
 */
public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final BooleanSupplier healthCheck;
    private volatile boolean ready;

    public ApiServer(int port, JobStore jobStore, JobLogStore jobLogStore, ScheduleStore scheduleStore,
                     JobDispatcher dispatcher, JobScheduler scheduler, CollectorRegistry registry,
                     SchedulerMetrics metrics, BooleanSupplier healthCheck, Clock clock) throws IOException {
        this.healthCheck = healthCheck;
        ObjectMapper mapper = objectMapper();

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/healthz", exchange -> {
            boolean healthy;
            try {
                healthy = this.healthCheck.getAsBoolean();
            } catch (RuntimeException e) {
                log.warn("Health check failed: {}", e.getMessage());
                healthy = false;
            }
            respondText(exchange, healthy ? 200 : 503, healthy ? "OK" : "UNHEALTHY");
        });
        server.createContext("/readyz", exchange -> respondText(exchange, ready ? 200 : 503, ready ? "READY" : "NOT_READY"));
        server.createContext("/metrics", new MetricsHandler(registry));
        server.createContext("/jobs", new JobsHandler(jobStore, jobLogStore, dispatcher, clock, mapper, metrics));
        server.createContext("/schedules", new SchedulesHandler(scheduleStore, scheduler, mapper, metrics));
        this.executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
    }

    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public void start() {
        server.start();
        ready = true;
        log.info("Scheduler HTTP server started on port {}", getPort());
    }

    public void stop() {
        ready = false;
        server.stop(1);
        executor.shutdownNow();
        log.info("Scheduler HTTP server stopped");
    }

    /** Bound port; differs from the requested one when 0 was asked for. */
    public int getPort() {
        return server.getAddress().getPort();
    }

    public boolean isReady() {
        return ready;
    }

    private static void respondText(HttpExchange exchange, int code, String body) throws IOException {
        byte[] data = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }
}
