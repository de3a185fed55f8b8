package com.safee.jobs.queue;

import com.safee.jobs.store.Job;
import com.safee.jobs.store.JobStore;
import com.safee.jobs.store.NewJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * "Enqueue a job of kind K": records the job row, then hands its id to the queue for that kind.
 * The row is the source of truth; the message only carries {@code {jobId}}.
 */
public class JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore jobStore;
    private final QueueManager queueManager;

    public JobDispatcher(JobStore jobStore, QueueManager queueManager) {
        this.jobStore = jobStore;
        this.queueManager = queueManager;
    }

    public EnqueuedJob enqueue(NewJob data) {
        Job job = jobStore.createJob(data);
        EnqueueResult result = queueManager.addJobByName(job.getJobName(), jobData(job), EnqueueOptions.defaults()
                .priority(job.getPriority())
                .organizationId(job.getOrganizationId())
                .deliverAt(job.getScheduledFor()));
        log.info("Job {} ({}) queued as {}", job.getId(), job.getJobName(), result);
        return new EnqueuedJob(job, result);
    }

    static Map<String, Object> jobData(Job job) {
        Map<String, Object> data = new HashMap<>();
        data.put(QueueMessage.JOB_ID, job.getId().toString());
        return data;
    }
}
