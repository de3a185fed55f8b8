package com.safee.jobs.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.time.Instant;
import java.time.ZoneId;

import org.junit.Test;

public class CronExpressionsTest {

    @Test
    public void fiveFieldsAreMinuteResolution() {
        Instant next = CronExpressions.nextExecution("*/5 * * * *", "UTC", Instant.parse("2024-03-01T10:02:30Z"))
                .orElseThrow();
        assertThat(next, is(Instant.parse("2024-03-01T10:05:00Z")));
    }

    @Test
    public void sixFieldsStartWithSeconds() {
        Instant next = CronExpressions.nextExecution("30 0 9 * * *", "UTC", Instant.parse("2024-03-01T09:00:00Z"))
                .orElseThrow();
        assertThat(next, is(Instant.parse("2024-03-01T09:00:30Z")));
    }

    @Test
    public void evaluatedInTheScheduleZone() {
        // 09:00 in Cairo (UTC+2 in winter) is 07:00Z
        Instant next = CronExpressions.nextExecution("0 9 * * *", "Africa/Cairo", Instant.parse("2024-01-10T00:00:00Z"))
                .orElseThrow();
        assertThat(next, is(Instant.parse("2024-01-10T07:00:00Z")));
    }

    @Test
    public void nextIsStrictlyAfter() {
        Instant at = Instant.parse("2024-03-01T10:05:00Z");
        assertThat(CronExpressions.nextExecution("*/5 * * * *", "UTC", at).orElseThrow(),
                is(Instant.parse("2024-03-01T10:10:00Z")));
    }

    @Test
    public void blankZoneMeansUtc() {
        assertThat(CronExpressions.zone(null), is(ZoneId.of("UTC")));
        assertThat(CronExpressions.zone(" "), is(ZoneId.of("UTC")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsWrongFieldCount() {
        CronExpressions.parse("* * *");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsGarbage() {
        CronExpressions.parse("61 * * * *");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBlank() {
        CronExpressions.parse("  ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnknownZone() {
        CronExpressions.zone("Mars/Olympus");
    }
}
