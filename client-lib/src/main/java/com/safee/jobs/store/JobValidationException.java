package com.safee.jobs.store;

public class JobValidationException extends JobEngineException {
    public JobValidationException(String message) {
        super(message);
    }
}
