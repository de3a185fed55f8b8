package com.safee.jobs.store;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.safee.jobs.db.H2DataSources;
import com.zaxxer.hikari.HikariDataSource;

public class JobLogStoreTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private HikariDataSource ds;
    private MutableClock clock;
    private JobStore jobs;
    private JobLogStore logs;
    private Job job;

    @Before
    public void setUp() {
        ds = H2DataSources.fresh();
        clock = new MutableClock(T0);
        jobs = new JobStore(ds, clock);
        logs = new JobLogStore(ds, clock);
        job = jobs.createJob(NewJob.of(JobName.SEND_EMAIL));
    }

    @After
    public void tearDown() {
        ds.close();
    }

    private void logAndTick(JobLogLevel level, String message) {
        logs.createJobLog(job.getId(), level, message, Map.of("step", message));
        clock.advance(Duration.ofSeconds(1));
    }

    private static List<String> messages(List<JobLog> entries) {
        return entries.stream().map(JobLog::getMessage).collect(Collectors.toList());
    }

    @Test
    public void logsComeBackNewestFirst() {
        logAndTick(JobLogLevel.INFO, "queued");
        logAndTick(JobLogLevel.DEBUG, "picked up");
        logAndTick(JobLogLevel.ERROR, "smtp refused");

        List<JobLog> entries = logs.getJobLogs(job.getId());

        assertThat(messages(entries), is(List.of("smtp refused", "picked up", "queued")));
        assertThat(entries.get(0).getLevel(), is(JobLogLevel.ERROR));
        assertThat(entries.get(0).getMetadata().get("step"), is("smtp refused"));
    }

    @Test
    public void filterByLevelWithPaging() {
        logAndTick(JobLogLevel.INFO, "one");
        logAndTick(JobLogLevel.INFO, "two");
        logAndTick(JobLogLevel.WARN, "three");
        logAndTick(JobLogLevel.INFO, "four");

        assertThat(messages(logs.getJobLogs(job.getId(), EnumSet.of(JobLogLevel.INFO), 2, 1)),
                is(List.of("two", "one")));
    }

    @Test
    public void errorLogsAreWarnAndError() {
        logAndTick(JobLogLevel.INFO, "fine");
        logAndTick(JobLogLevel.WARN, "slow");
        logAndTick(JobLogLevel.ERROR, "broken");

        assertThat(messages(logs.getJobErrorLogs(job.getId())), is(List.of("broken", "slow")));
    }

    @Test
    public void cleanupRemovesOnlyOldLogs() {
        logAndTick(JobLogLevel.INFO, "old");
        clock.advance(Duration.ofDays(30));
        logAndTick(JobLogLevel.INFO, "recent");

        int removed = logs.cleanupOldJobLogs(T0.plus(Duration.ofDays(7)));

        assertThat(removed, is(1));
        assertThat(messages(logs.getJobLogs(job.getId())), is(List.of("recent")));
    }

    @Test
    public void deletingTheJobDeletesItsLogs() {
        logs.info(job.getId(), "created");

        jobs.deleteJob(job.getId());

        assertThat(logs.getJobLogs(job.getId()).isEmpty(), is(true));
    }

    @Test(expected = JobValidationException.class)
    public void messageIsRequired() {
        logs.createJobLog(job.getId(), JobLogLevel.INFO, null, null);
    }
}
