package com.safee.jobs.worker;

import com.safee.jobs.queue.JobQueues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static com.safee.jobs.config.Env.env;
import static com.safee.jobs.config.Env.envInt;
import static com.safee.jobs.config.Env.envLong;

/** Worker process settings, read from WORKER_* variables. */
public class WorkerConfig {
    private String workerId = "worker-" + UUID.randomUUID();
    private int httpPort = 8080;
    private long pollIntervalMs = 1000;
    private int concurrency = 5;
    private int rateLimitMax = 10;
    private long rateLimitWindowMs = 1000;
    private long backoffBaseMs = RetryBackoff.DEFAULT_BASE_MS;
    private long backoffMaxMs = RetryBackoff.DEFAULT_MAX_MS;
    private List<String> queues = JobQueues.allQueues();

    public static WorkerConfig fromEnv() {
        WorkerConfig c = new WorkerConfig();
        c.workerId = env("WORKER_ID", c.workerId);
        c.httpPort = envInt("WORKER_HTTP_PORT", c.httpPort);
        c.pollIntervalMs = envLong("WORKER_POLL_INTERVAL_MS", c.pollIntervalMs);
        c.concurrency = envInt("WORKER_CONCURRENCY", c.concurrency);
        c.rateLimitMax = envInt("WORKER_RATE_LIMIT_MAX", c.rateLimitMax);
        c.rateLimitWindowMs = envLong("WORKER_RATE_LIMIT_WINDOW_MS", c.rateLimitWindowMs);
        c.backoffBaseMs = envLong("WORKER_BACKOFF_BASE_MS", c.backoffBaseMs);
        c.backoffMaxMs = envLong("WORKER_BACKOFF_MAX_MS", c.backoffMaxMs);
        c.queues = parseQueues(env("WORKER_QUEUES", ""));
        return c;
    }

    /**
     * Comma separated queue names; blank or {@code all} selects every queue.
     *
     * @throws IllegalArgumentException for a name that is not a known queue
     */
    static List<String> parseQueues(String raw) {
        if (raw == null || raw.isBlank() || "all".equalsIgnoreCase(raw.trim())) {
            return JobQueues.allQueues();
        }
        List<String> known = JobQueues.allQueues();
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String name = part.trim();
            if (name.isEmpty()) {
                continue;
            }
            if (!known.contains(name)) {
                throw new IllegalArgumentException("unknown queue '" + name + "', expected one of " + known);
            }
            if (!out.contains(name)) {
                out.add(name);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public String getWorkerId() {
        return workerId;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getRateLimitMax() {
        return rateLimitMax;
    }

    public long getRateLimitWindowMs() {
        return rateLimitWindowMs;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public List<String> getQueues() {
        return queues;
    }
}
