package com.safee.jobs.queue;

import java.util.UUID;

/** Where a message landed. Queue ids are transient and not stored on the job row. */
public class EnqueueResult {
    private final String queueName;
    private final UUID messageId;

    public EnqueueResult(String queueName, UUID messageId) {
        this.queueName = queueName;
        this.messageId = messageId;
    }

    public String getQueueName() {
        return queueName;
    }

    public UUID getMessageId() {
        return messageId;
    }

    @Override
    public String toString() {
        return queueName + "/" + messageId;
    }
}
