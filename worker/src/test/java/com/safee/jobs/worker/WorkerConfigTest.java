package com.safee.jobs.worker;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.List;

import org.junit.Test;

import com.safee.jobs.queue.JobQueues;

public class WorkerConfigTest {

    @Test
    public void blankOrAllMeansEveryQueue() {
        assertThat(WorkerConfig.parseQueues(""), is(JobQueues.allQueues()));
        assertThat(WorkerConfig.parseQueues(null), is(JobQueues.allQueues()));
        assertThat(WorkerConfig.parseQueues("ALL"), is(JobQueues.allQueues()));
    }

    @Test
    public void listIsTrimmedAndDeduplicated() {
        assertThat(WorkerConfig.parseQueues(" email, reports ,email,"), is(List.of("email", "reports")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownQueueIsRejected() {
        WorkerConfig.parseQueues("email,printing");
    }

    @Test
    public void defaultsWithoutEnvironment() {
        WorkerConfig c = new WorkerConfig();
        assertThat(c.getConcurrency(), is(5));
        assertThat(c.getRateLimitMax(), is(10));
        assertThat(c.getRateLimitWindowMs(), is(1000L));
        assertThat(c.getBackoffBaseMs(), is(5000L));
        assertThat(c.getBackoffMaxMs(), is(60000L));
    }
}
