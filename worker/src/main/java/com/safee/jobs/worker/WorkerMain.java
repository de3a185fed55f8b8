package com.safee.jobs.worker;

import com.datastax.oss.driver.api.core.CqlSession;
import com.safee.jobs.db.DataSources;
import com.safee.jobs.db.SchemaInitializer;
import com.safee.jobs.queue.CassandraMessageQueue;
import com.safee.jobs.queue.CassandraSchema;
import com.safee.jobs.store.JobLogStore;
import com.safee.jobs.store.JobStore;
import com.safee.jobs.worker.metrics.PromWorkerMetrics;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import com.zaxxer.hikari.HikariDataSource;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.prometheus.client.hotspot.DefaultExports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;

import static com.safee.jobs.config.Env.envBool;
import static com.safee.jobs.config.Env.envInt;

public class WorkerMain {
    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);
    private static final long SHUTDOWN_TIMEOUT_MS = 30_000;

    private static volatile boolean ready = false;

    public static void main(String[] args) throws Exception {
        WorkerConfig config = WorkerConfig.fromEnv();
        int buckets = envInt("QUEUE_BUCKETS", 16);

        HikariDataSource dataSource = DataSources.fromEnv("worker-db");
        if (envBool("DB_INIT_SCHEMA", true)) {
            SchemaInitializer.apply(dataSource);
        }
        CqlSession session = CassandraSchema.connectFromEnv();

        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        DefaultExports.initialize();
        WorkerMetrics metrics = new PromWorkerMetrics(registry);

        Clock clock = Clock.systemUTC();
        JobStore jobStore = new JobStore(dataSource, clock);
        JobLogStore jobLogStore = new JobLogStore(dataSource, clock);
        CassandraMessageQueue queue = new CassandraMessageQueue(session, buckets, clock);
        JobProcessorRegistry processors = JobProcessorRegistry.loadInstalled();
        JobRunner runner = new JobRunner(jobStore, jobLogStore, processors, queue,
                new RetryBackoff(config.getBackoffBaseMs(), config.getBackoffMaxMs()), metrics, clock);

        List<QueueWorker> workers = new ArrayList<>();
        for (String queueName : config.getQueues()) {
            workers.add(new QueueWorker(queueName, queue, runner,
                    new RateLimiter(config.getRateLimitMax(), config.getRateLimitWindowMs()),
                    config.getConcurrency(), config.getPollIntervalMs(), clock));
        }

        HttpServer server = HttpServer.create(new InetSocketAddress(config.getHttpPort()), 0);
        server.createContext("/healthz", exchange -> {
            boolean healthy = isHealthy(dataSource, session);
            respond(exchange, healthy ? 200 : 503, healthy ? "OK" : "UNHEALTHY");
        });
        server.createContext("/readyz", exchange -> respond(exchange, ready ? 200 : 503, ready ? "READY" : "NOT_READY"));
        server.createContext("/metrics", new MetricsHandler(registry));
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();

        for (QueueWorker worker : workers) {
            worker.start();
        }
        ready = true;
        log.info("Worker {} started on port {} for queues {}", config.getWorkerId(), config.getHttpPort(),
                config.getQueues());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Worker {} shutting down", config.getWorkerId());
            ready = false;
            for (QueueWorker worker : workers) {
                try {
                    worker.stop(SHUTDOWN_TIMEOUT_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            server.stop(1);
            session.close();
            dataSource.close();
            log.info("Worker {} shutdown complete", config.getWorkerId());
        }));
    }

    private static boolean isHealthy(HikariDataSource dataSource, CqlSession session) {
        try (Connection c = dataSource.getConnection()) {
            if (!c.isValid(2)) {
                return false;
            }
            session.execute("SELECT now() FROM system.local");
            return true;
        } catch (SQLException | RuntimeException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static void respond(HttpExchange exchange, int code, String body) throws IOException {
        byte[] data = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    static class MetricsHandler implements HttpHandler {
        private final CollectorRegistry registry;

        MetricsHandler(CollectorRegistry registry) {
            this.registry = registry;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            exchange.getResponseHeaders().set("Content-Type", TextFormat.CONTENT_TYPE_004);
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            byte[] data = writer.toString().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, data.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(data);
            }
        }
    }
}
