package com.safee.jobs.worker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.safee.jobs.queue.MessageSource;
import com.safee.jobs.queue.QueueMessage;
import com.safee.jobs.store.JobName;

/** In-memory queue with the poll/claim contract of the Cassandra one. */
class FakeMessageSource implements MessageSource {
    private final int buckets;
    private final List<QueueMessage> messages = new ArrayList<>();
    private final Set<UUID> stolen = new HashSet<>();
    private final List<QueueMessage> requeued = new ArrayList<>();

    FakeMessageSource(int buckets) {
        this.buckets = buckets;
    }

    synchronized QueueMessage add(String queue, int bucket) {
        QueueMessage m = new QueueMessage(queue, bucket, Instant.EPOCH, UUID.randomUUID(), JobName.SEND_BULK_EMAIL,
                null, null, Map.of(QueueMessage.JOB_ID, UUID.randomUUID().toString()), 1);
        messages.add(m);
        return m;
    }

    /** Makes the next claim of {@code m} lose, as if another worker took it. */
    synchronized void stealOnClaim(QueueMessage m) {
        stolen.add(m.getMessageId());
    }

    synchronized int remaining() {
        return messages.size();
    }

    synchronized List<QueueMessage> requeued() {
        return new ArrayList<>(requeued);
    }

    @Override
    public int buckets() {
        return buckets;
    }

    @Override
    public synchronized List<QueueMessage> poll(String queueName, int bucket, Instant now, int limit) {
        List<QueueMessage> out = new ArrayList<>();
        for (QueueMessage m : messages) {
            if (out.size() >= limit) {
                break;
            }
            if (m.getQueueName().equals(queueName) && m.getBucket() == bucket && !m.getDeliverAt().isAfter(now)) {
                out.add(m);
            }
        }
        return out;
    }

    @Override
    public synchronized boolean claim(QueueMessage message) {
        boolean present = messages.remove(message);
        if (stolen.remove(message.getMessageId())) {
            return false;
        }
        return present;
    }

    @Override
    public synchronized QueueMessage requeue(QueueMessage message, Instant deliverAt) {
        QueueMessage again = new QueueMessage(message.getQueueName(), message.getBucket(), deliverAt,
                message.getMessageId(), message.getJobName(), message.getPriority(), message.getOrganizationId(),
                message.getData(), message.getDelivery() + 1);
        requeued.add(again);
        messages.add(again);
        return again;
    }
}
