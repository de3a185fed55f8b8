package com.safee.jobs.queue;

import com.safee.jobs.store.JobName;

import java.util.Map;

/**
 * Producer side of the job queues.
 */
public interface QueueManager {

    /**
     * Routes {@code data} to the queue serving {@code jobName} (see {@link JobQueues}).
     */
    EnqueueResult addJobByName(JobName jobName, Map<String, Object> data, EnqueueOptions options);
}
