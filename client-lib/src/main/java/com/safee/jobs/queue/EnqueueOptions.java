package com.safee.jobs.queue;

import com.safee.jobs.store.JobPriority;

import java.time.Instant;

/**
 * Delivery options of one queue message. A null deliverAt means deliver now.
 */
public class EnqueueOptions {
    private JobPriority priority = JobPriority.NORMAL;
    private String organizationId;
    private Instant deliverAt;

    public static EnqueueOptions defaults() {
        return new EnqueueOptions();
    }

    public EnqueueOptions priority(JobPriority priority) {
        this.priority = priority == null ? JobPriority.NORMAL : priority;
        return this;
    }

    public EnqueueOptions organizationId(String organizationId) {
        this.organizationId = organizationId;
        return this;
    }

    public EnqueueOptions deliverAt(Instant deliverAt) {
        this.deliverAt = deliverAt;
        return this;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public Instant getDeliverAt() {
        return deliverAt;
    }
}
