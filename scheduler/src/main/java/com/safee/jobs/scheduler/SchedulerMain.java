package com.safee.jobs.scheduler;

import com.datastax.oss.driver.api.core.CqlSession;
import com.safee.jobs.db.DataSources;
import com.safee.jobs.db.SchemaInitializer;
import com.safee.jobs.lock.CassandraLeaseStore;
import com.safee.jobs.lock.LockClient;
import com.safee.jobs.queue.CassandraMessageQueue;
import com.safee.jobs.queue.CassandraSchema;
import com.safee.jobs.queue.JobDispatcher;
import com.safee.jobs.scheduler.api.ApiServer;
import com.safee.jobs.scheduler.metrics.PromLockMetrics;
import com.safee.jobs.scheduler.metrics.SchedulerMetrics;
import com.safee.jobs.store.JobLogStore;
import com.safee.jobs.store.JobStore;
import com.safee.jobs.store.ScheduleStore;
import com.zaxxer.hikari.HikariDataSource;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.hotspot.DefaultExports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.safee.jobs.config.Env.envBool;
import static com.safee.jobs.config.Env.envInt;

public class SchedulerMain {
    private static final Logger log = LoggerFactory.getLogger(SchedulerMain.class);

    public static void main(String[] args) throws Exception {
        int httpPort = envInt("SCHEDULER_HTTP_PORT", 8082);
        int buckets = envInt("QUEUE_BUCKETS", 16);
        int threads = envInt("SCHEDULER_THREADS", 2);
        int fireLockTtl = envInt("SCHEDULER_FIRE_LOCK_TTL_SECONDS", 60);
        boolean fireLockEnabled = envBool("SCHEDULER_FIRE_LOCK_ENABLED", true);

        HikariDataSource dataSource = DataSources.fromEnv("scheduler-db");
        if (envBool("DB_INIT_SCHEMA", true)) {
            SchemaInitializer.apply(dataSource);
        }
        CqlSession session = CassandraSchema.connectFromEnv();

        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        DefaultExports.initialize();
        SchedulerMetrics metrics = new SchedulerMetrics(registry);

        Clock clock = Clock.systemUTC();
        JobStore jobStore = new JobStore(dataSource, clock);
        ScheduleStore scheduleStore = new ScheduleStore(dataSource, clock);
        JobLogStore jobLogStore = new JobLogStore(dataSource, clock);
        CassandraMessageQueue queue = new CassandraMessageQueue(session, buckets, clock);

        FireGuard fireGuard = FireGuard.always();
        if (fireLockEnabled) {
            LockClient lockClient = new LockClient(new CassandraLeaseStore(session), new PromLockMetrics(registry));
            fireGuard = new LeaseFireGuard(lockClient, fireLockTtl);
        }

        ScheduledExecutorService executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "cron-trigger");
            t.setDaemon(true);
            return t;
        });
        JobScheduler scheduler = new JobScheduler(scheduleStore, jobStore, jobLogStore, queue, executor, clock, fireGuard);

        ApiServer api = new ApiServer(httpPort, jobStore, jobLogStore, scheduleStore,
                new JobDispatcher(jobStore, queue), scheduler, registry, metrics,
                () -> isHealthy(dataSource, session), clock);

        scheduler.start();
        executor.scheduleAtFixedRate(() -> metrics.setActiveTriggers(scheduler.scheduledIds().size()),
                0, 10, TimeUnit.SECONDS);
        api.start();
        log.info("Scheduler started (http={}, buckets={}, fireLock={})", api.getPort(), buckets, fireLockEnabled);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Scheduler shutting down");
            api.stop();
            scheduler.stop();
            executor.shutdownNow();
            session.close();
            dataSource.close();
        }));
    }

    private static boolean isHealthy(HikariDataSource dataSource, CqlSession session) {
        try (Connection c = dataSource.getConnection()) {
            if (!c.isValid(2)) {
                return false;
            }
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
        session.execute("SELECT now() FROM system.local");
        return true;
    }
}
