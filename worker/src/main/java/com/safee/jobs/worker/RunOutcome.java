package com.safee.jobs.worker;

/** What one delivery of a message did to its job. */
public enum RunOutcome {
    COMPLETED("completed"),
    RETRYING("retrying"),
    FAILED("failed"),
    /** Job already terminal, nothing run. */
    SKIPPED("skipped"),
    /** Message without a usable job row. */
    DROPPED("dropped");

    private final String label;

    RunOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
