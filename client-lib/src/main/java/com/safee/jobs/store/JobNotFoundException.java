package com.safee.jobs.store;

import java.util.UUID;

public class JobNotFoundException extends NotFoundException {
    public JobNotFoundException(UUID jobId) {
        super("Job", jobId);
    }
}
