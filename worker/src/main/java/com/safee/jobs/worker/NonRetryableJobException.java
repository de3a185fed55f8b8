package com.safee.jobs.worker;

/** Failure that no later attempt can fix, e.g. a payload the processor rejects. */
public class NonRetryableJobException extends RuntimeException {
    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
