package com.safee.jobs.queue;

import com.safee.jobs.store.Job;

/** A job row together with the queue message that carries it. */
public class EnqueuedJob {
    private final Job job;
    private final EnqueueResult enqueueResult;

    public EnqueuedJob(Job job, EnqueueResult enqueueResult) {
        this.job = job;
        this.enqueueResult = enqueueResult;
    }

    public Job getJob() {
        return job;
    }

    public EnqueueResult getEnqueueResult() {
        return enqueueResult;
    }
}
