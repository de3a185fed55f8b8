package com.safee.jobs.store;

public class JobEngineException extends RuntimeException {
    public JobEngineException(String message) {
        super(message);
    }

    public JobEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
