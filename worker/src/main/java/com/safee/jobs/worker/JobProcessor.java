package com.safee.jobs.worker;

import com.safee.jobs.store.Job;
import com.safee.jobs.store.JobName;

import java.util.Map;

/**
 * Executes the payload of one kind of job. Implementations are found through
 * {@link java.util.ServiceLoader} or registered on a {@link JobProcessorRegistry}.
 *
 * Throwing marks the attempt as failed; {@link NonRetryableJobException} also rules out retries.
 */
public interface JobProcessor {

    JobName jobName();

    /**
     * @return the result stored on the job, may be null
     */
    Map<String, Object> process(Job job) throws Exception;
}
