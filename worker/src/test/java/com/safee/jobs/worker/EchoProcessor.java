package com.safee.jobs.worker;

import java.util.HashMap;
import java.util.Map;

import com.safee.jobs.store.Job;
import com.safee.jobs.store.JobName;

/** Registered through META-INF/services; returns the payload it was given. */
public class EchoProcessor implements JobProcessor {

    @Override
    public JobName jobName() {
        return JobName.CALCULATE_ANALYTICS;
    }

    @Override
    public Map<String, Object> process(Job job) {
        Map<String, Object> result = new HashMap<>();
        result.put("echo", job.getPayload());
        return result;
    }
}
