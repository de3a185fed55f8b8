package com.safee.jobs.scheduler;

public enum SchedulerState {
    STOPPED,
    RUNNING
}
