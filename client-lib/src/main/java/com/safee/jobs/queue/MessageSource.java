package com.safee.jobs.queue;

import java.time.Instant;
import java.util.List;

/**
 * Consumer side of the job queues, used by workers.
 */
public interface MessageSource {

    int buckets();

    /**
     * Messages of one bucket that are due at {@code now}, highest priority first.
     * Polling does not remove anything; a message belongs to whoever {@link #claim claims} it.
     */
    List<QueueMessage> poll(String queueName, int bucket, Instant now, int limit);

    /**
     * @return true iff this caller removed the message and now owns the delivery
     */
    boolean claim(QueueMessage message);

    /**
     * Puts a claimed message back for a later delivery, with the delivery counter incremented.
     */
    QueueMessage requeue(QueueMessage message, Instant deliverAt);
}
