package com.safee.jobs.store;

public class DuplicateScheduleException extends JobEngineException {
    public DuplicateScheduleException(String name, JobName jobName) {
        super("Job schedule with name '" + name + "' already exists for job " + jobName.getValue());
    }
}
