package com.safee.jobs.store;

import java.util.UUID;

public class ScheduleNotFoundException extends NotFoundException {
    public ScheduleNotFoundException(UUID scheduleId) {
        super("Job schedule", scheduleId);
    }
}
