package com.safee.jobs.queue;

import com.safee.jobs.store.JobName;
import com.safee.jobs.store.JobPriority;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * One delivery of a queued job. {@code (queueName, bucket, deliverAt, messageId)} is the row key.
 */
public class QueueMessage {
    public static final String JOB_ID = "jobId";

    private final String queueName;
    private final int bucket;
    private final Instant deliverAt;
    private final UUID messageId;
    private final JobName jobName;
    private final JobPriority priority;
    private final String organizationId;
    private final Map<String, Object> data;
    private final int delivery;

    public QueueMessage(String queueName, int bucket, Instant deliverAt, UUID messageId, JobName jobName,
                        JobPriority priority, String organizationId, Map<String, Object> data, int delivery) {
        this.queueName = queueName;
        this.bucket = bucket;
        this.deliverAt = deliverAt;
        this.messageId = messageId;
        this.jobName = jobName;
        this.priority = priority == null ? JobPriority.NORMAL : priority;
        this.organizationId = organizationId;
        this.data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(data);
        this.delivery = delivery;
    }

    public String getQueueName() {
        return queueName;
    }

    public int getBucket() {
        return bucket;
    }

    public Instant getDeliverAt() {
        return deliverAt;
    }

    public UUID getMessageId() {
        return messageId;
    }

    public JobName getJobName() {
        return jobName;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /** 1 for the first hand-off, incremented by every requeue. */
    public int getDelivery() {
        return delivery;
    }

    /**
     * The job id carried in {@link #getData()}, or null when absent or malformed.
     */
    public UUID jobId() {
        Object raw = data.get(JOB_ID);
        if (raw == null) {
            return null;
        }
        try {
            return UUID.fromString(raw.toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "QueueMessage{queue=" + queueName + ", bucket=" + bucket + ", id=" + messageId + ", job="
                + data.get(JOB_ID) + ", delivery=" + delivery + "}";
    }
}
