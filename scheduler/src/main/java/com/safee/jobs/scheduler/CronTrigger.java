package com.safee.jobs.scheduler;

import com.cronutils.model.Cron;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Cancellable in-memory timer for one schedule. Arms a one-shot task for the next cron
 * instant and re-arms itself after every fire. Missed fires are not replayed.
 */
public class CronTrigger {
    private static final Logger log = LoggerFactory.getLogger(CronTrigger.class);

    private final UUID scheduleId;
    private final Cron cron;
    private final ZoneId zone;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final Consumer<Instant> onFire;

    private ScheduledFuture<?> pending;
    private Instant nextFireTime;
    private boolean cancelled;

    public CronTrigger(UUID scheduleId, Cron cron, ZoneId zone, ScheduledExecutorService executor, Clock clock,
                       Consumer<Instant> onFire) {
        this.scheduleId = scheduleId;
        this.cron = cron;
        this.zone = zone;
        this.executor = executor;
        this.clock = clock;
        this.onFire = onFire;
    }

    /**
     * Arms the first fire.
     *
     * @return the first fire time, empty when the expression never fires again
     */
    public synchronized Optional<Instant> start() {
        return arm(clock.instant());
    }

    public synchronized void cancel() {
        cancelled = true;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized Instant getNextFireTime() {
        return nextFireTime;
    }

    public UUID getScheduleId() {
        return scheduleId;
    }

    /** Next cron instant strictly after {@code after}, in this trigger's zone. */
    public Optional<Instant> nextAfter(Instant after) {
        return CronExpressions.nextExecution(cron, zone, after);
    }

    private Optional<Instant> arm(Instant after) {
        if (cancelled) {
            return Optional.empty();
        }
        Optional<Instant> next = nextAfter(after);
        if (next.isEmpty()) {
            log.warn("Schedule {} has no further fire time", scheduleId);
            nextFireTime = null;
            return next;
        }
        Instant fireTime = next.get();
        long delayMs = Math.max(0, Duration.between(clock.instant(), fireTime).toMillis());
        nextFireTime = fireTime;
        pending = executor.schedule(() -> fire(fireTime), delayMs, TimeUnit.MILLISECONDS);
        return next;
    }

    private void fire(Instant fireTime) {
        synchronized (this) {
            if (cancelled) {
                return;
            }
        }
        try {
            onFire.accept(fireTime);
        } catch (RuntimeException e) {
            log.error("Cron fire failed for schedule {} at {}", scheduleId, fireTime, e);
        }
        synchronized (this) {
            // never re-arm at or before the instant that just fired
            Instant now = clock.instant();
            arm(now.isAfter(fireTime) ? now : fireTime);
        }
    }
}
