package com.safee.jobs.store;

/**
 * Database failure during a store operation. Carries the operation name for the logs.
 */
public class StoreException extends JobEngineException {
    private final String operation;

    public StoreException(String operation, Throwable cause) {
        super("Database error during " + operation + ": " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
