package com.safee.jobs.worker;

import com.safee.jobs.queue.MessageSource;
import com.safee.jobs.queue.QueueMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes one queue: a poller thread walks the buckets, claims due messages and hands them
 * to a bounded pool. At most {@code concurrency} jobs of this queue run at once and the
 * {@link RateLimiter} caps how many start per window.
 */
public class QueueWorker {
    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final String queueName;
    private final MessageSource source;
    private final JobRunner runner;
    private final RateLimiter rateLimiter;
    private final int concurrency;
    private final long pollIntervalMs;
    private final Clock clock;

    private final Semaphore slots;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final ExecutorService pool;
    private volatile boolean running;
    private boolean stopped;
    private Thread poller;

    public QueueWorker(String queueName, MessageSource source, JobRunner runner, RateLimiter rateLimiter,
                       int concurrency, long pollIntervalMs, Clock clock) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0, got: " + concurrency);
        }
        this.queueName = queueName;
        this.source = source;
        this.runner = runner;
        this.rateLimiter = rateLimiter;
        this.concurrency = concurrency;
        this.pollIntervalMs = pollIntervalMs;
        this.clock = clock;
        this.slots = new Semaphore(concurrency);
        this.pool = Executors.newFixedThreadPool(concurrency, r -> {
            Thread t = new Thread(r, "worker-" + queueName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts polling. A worker that has been stopped cannot be started again.
     *
     * @throws IllegalStateException after {@link #stop(long)}
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        if (stopped) {
            throw new IllegalStateException("Queue worker " + queueName + " was stopped and cannot be restarted");
        }
        running = true;
        poller = new Thread(this::pollLoop, "poller-" + queueName);
        poller.setDaemon(true);
        poller.start();
        log.info("Queue worker {} started (concurrency={})", queueName, concurrency);
    }

    /**
     * Stops polling and waits up to {@code timeoutMs} for in-flight jobs.
     *
     * @return true when every in-flight job finished in time
     */
    public boolean stop(long timeoutMs) throws InterruptedException {
        Thread p;
        synchronized (this) {
            stopped = true;
            if (!running) {
                pool.shutdown();
                return pool.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
            }
            running = false;
            p = poller;
        }
        p.interrupt();
        p.join(timeoutMs);
        pool.shutdown();
        boolean drained = pool.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
        if (!drained) {
            log.warn("Queue worker {} stopped with {} jobs still running", queueName, inFlight.get());
        } else {
            log.info("Queue worker {} stopped", queueName);
        }
        return drained;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public String getQueueName() {
        return queueName;
    }

    public boolean isRunning() {
        return running;
    }

    private void pollLoop() {
        int buckets = source.buckets();
        while (running) {
            try {
                int dispatched = 0;
                for (int bucket = 0; bucket < buckets && running; bucket++) {
                    dispatched += pollBucket(bucket);
                }
                if (dispatched == 0) {
                    Thread.sleep(pollIntervalMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Poll error on queue {}", queueName, e);
                try {
                    Thread.sleep(pollIntervalMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    private int pollBucket(int bucket) throws InterruptedException {
        int free = slots.availablePermits();
        if (free == 0) {
            slots.acquire();
            slots.release();
            free = slots.availablePermits();
        }
        List<QueueMessage> due = source.poll(queueName, bucket, clock.instant(), Math.max(1, free));
        int dispatched = 0;
        for (QueueMessage message : due) {
            if (!running) {
                break;
            }
            slots.acquire();
            boolean handedOff = false;
            try {
                rateLimiter.acquire();
                if (!source.claim(message)) {
                    log.debug("Message {} claimed by another worker", message.getMessageId());
                    continue;
                }
                inFlight.incrementAndGet();
                try {
                    pool.execute(() -> runClaimed(message));
                } catch (RejectedExecutionException e) {
                    inFlight.decrementAndGet();
                    throw e;
                }
                handedOff = true;
                dispatched++;
            } finally {
                if (!handedOff) {
                    slots.release();
                }
            }
        }
        return dispatched;
    }

    private void runClaimed(QueueMessage message) {
        try {
            RunOutcome outcome = runner.run(message);
            log.debug("Message {} on {} -> {}", message.getMessageId(), queueName, outcome);
        } catch (RuntimeException e) {
            log.error("Job run failed for message {} on {}", message.getMessageId(), queueName, e);
        } finally {
            inFlight.decrementAndGet();
            slots.release();
        }
    }
}
