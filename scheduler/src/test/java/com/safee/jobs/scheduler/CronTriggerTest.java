package com.safee.jobs.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Test;

public class CronTriggerTest {
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void firesRepeatedlyAtIncreasingInstants() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        List<Instant> fires = new CopyOnWriteArrayList<>();
        CronTrigger trigger = new CronTrigger(UUID.randomUUID(), CronExpressions.parse("* * * * * *"),
                ZoneOffset.UTC, executor, Clock.systemUTC(), t -> {
                    fires.add(t);
                    latch.countDown();
                });

        assertThat(trigger.start().isPresent(), is(true));
        assertThat(latch.await(5, TimeUnit.SECONDS), is(true));
        trigger.cancel();

        assertThat(fires.get(1).isAfter(fires.get(0)), is(true));
    }

    @Test
    public void cancelledTriggerNeverFires() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        CronTrigger trigger = new CronTrigger(UUID.randomUUID(), CronExpressions.parse("* * * * * *"),
                ZoneOffset.UTC, executor, Clock.systemUTC(), t -> latch.countDown());
        trigger.start();
        trigger.cancel();

        assertThat(latch.await(1500, TimeUnit.MILLISECONDS), is(false));
        assertThat(trigger.isCancelled(), is(true));
    }

    @Test
    public void failingHandlerDoesNotStopTheTrigger() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        CronTrigger trigger = new CronTrigger(UUID.randomUUID(), CronExpressions.parse("* * * * * *"),
                ZoneOffset.UTC, executor, Clock.systemUTC(), t -> {
                    latch.countDown();
                    throw new IllegalStateException("boom");
                });
        trigger.start();

        assertThat(latch.await(5, TimeUnit.SECONDS), is(true));
        trigger.cancel();
    }

    @Test
    public void nextFireTimeIsInTheFuture() {
        Instant now = Instant.now();
        CronTrigger trigger = new CronTrigger(UUID.randomUUID(), CronExpressions.parse("0 0 1 1 *"),
                ZoneOffset.UTC, executor, Clock.systemUTC(), t -> { });
        trigger.start();

        assertThat(trigger.getNextFireTime().compareTo(now), greaterThan(0));
        trigger.cancel();
    }
}
