package com.safee.jobs.queue;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.safee.jobs.db.JsonColumns;
import com.safee.jobs.store.JobName;
import com.safee.jobs.store.JobPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Job queues on a Cassandra table partitioned by (queue, bucket) and clustered by delivery time.
 * Workers scan buckets for due rows and take ownership with an LWT delete, so a message is
 * handed to at most one worker per delivery.
 */
public class CassandraMessageQueue implements QueueManager, MessageSource {
    private static final Logger log = LoggerFactory.getLogger(CassandraMessageQueue.class);

    static final Comparator<QueueMessage> DELIVERY_ORDER = Comparator
            .comparingInt((QueueMessage m) -> m.getPriority().rank())
            .thenComparing(QueueMessage::getDeliverAt);

    private final CqlSession session;
    private final int buckets;
    private final Clock clock;
    private final PreparedStatement insertStmt;
    private final PreparedStatement selectDueStmt;
    private final PreparedStatement claimStmt;

    public CassandraMessageQueue(CqlSession session, int buckets) {
        this(session, buckets, Clock.systemUTC());
    }

    public CassandraMessageQueue(CqlSession session, int buckets, Clock clock) {
        if (buckets <= 0) {
            throw new IllegalArgumentException("buckets must be > 0, got: " + buckets);
        }
        this.session = session;
        this.buckets = buckets;
        this.clock = clock;
        this.insertStmt = session.prepare(
                "INSERT INTO queue_messages (queue_name, bucket_id, deliver_at, message_id, job_id, job_name, "
                        + "organization_id, priority, data, delivery) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
        this.selectDueStmt = session.prepare(
                "SELECT queue_name, bucket_id, deliver_at, message_id, job_name, organization_id, priority, data, delivery "
                        + "FROM queue_messages WHERE queue_name = ? AND bucket_id = ? AND deliver_at <= ? LIMIT ?");
        this.claimStmt = session.prepare(
                "DELETE FROM queue_messages WHERE queue_name = ? AND bucket_id = ? AND deliver_at = ? AND message_id = ? IF EXISTS");
    }

    @Override
    public EnqueueResult addJobByName(JobName jobName, Map<String, Object> data, EnqueueOptions options) {
        EnqueueOptions opts = options == null ? EnqueueOptions.defaults() : options;
        String queueName = JobQueues.queueFor(jobName);
        UUID messageId = UUID.randomUUID();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant deliverAt = opts.getDeliverAt() == null || opts.getDeliverAt().isBefore(now)
                ? now : opts.getDeliverAt().truncatedTo(ChronoUnit.MILLIS);
        QueueMessage message = new QueueMessage(queueName, bucketFor(messageId), deliverAt, messageId, jobName,
                opts.getPriority(), opts.getOrganizationId(), data, 1);
        insert(message);
        log.debug("Queued {} for {} at {}", message, jobName, deliverAt);
        return new EnqueueResult(queueName, messageId);
    }

    @Override
    public int buckets() {
        return buckets;
    }

    @Override
    public List<QueueMessage> poll(String queueName, int bucket, Instant now, int limit) {
        BoundStatement bs = selectDueStmt.bind(queueName, bucket, now, limit);
        ResultSet rs = session.execute(bs);
        List<QueueMessage> out = new ArrayList<>();
        for (Row row : rs) {
            QueueMessage message = map(row);
            if (message != null) {
                out.add(message);
            }
        }
        out.sort(DELIVERY_ORDER);
        return out;
    }

    @Override
    public boolean claim(QueueMessage message) {
        Row row = session.execute(claimStmt.bind(message.getQueueName(), message.getBucket(),
                message.getDeliverAt(), message.getMessageId())).one();
        return row != null && row.getBoolean("[applied]");
    }

    @Override
    public QueueMessage requeue(QueueMessage message, Instant deliverAt) {
        QueueMessage next = new QueueMessage(message.getQueueName(), message.getBucket(),
                deliverAt.truncatedTo(ChronoUnit.MILLIS), message.getMessageId(), message.getJobName(),
                message.getPriority(), message.getOrganizationId(), message.getData(), message.getDelivery() + 1);
        insert(next);
        log.debug("Requeued {} for {}", next, next.getDeliverAt());
        return next;
    }

    int bucketFor(UUID messageId) {
        return Math.floorMod(messageId.hashCode(), buckets);
    }

    private void insert(QueueMessage m) {
        Object jobId = m.getData().get(QueueMessage.JOB_ID);
        session.execute(insertStmt.bind(m.getQueueName(), m.getBucket(), m.getDeliverAt(), m.getMessageId(),
                jobId == null ? null : jobId.toString(), m.getJobName().getValue(), m.getOrganizationId(),
                m.getPriority().rank(), JsonColumns.write(m.getData()), m.getDelivery()));
    }

    private static QueueMessage map(Row row) {
        String jobName = row.getString("job_name");
        UUID messageId = row.getUuid("message_id");
        if (jobName == null || messageId == null) {
            return null;
        }
        JobName name;
        try {
            name = JobName.fromValue(jobName);
        } catch (RuntimeException e) {
            log.warn("Skipping queue message {} with unknown job name {}", messageId, jobName);
            return null;
        }
        int priority = row.isNull("priority") ? JobPriority.NORMAL.rank() : row.getInt("priority");
        int delivery = row.isNull("delivery") ? 1 : row.getInt("delivery");
        return new QueueMessage(row.getString("queue_name"), row.getInt("bucket_id"), row.getInstant("deliver_at"),
                messageId, name, JobPriority.fromRank(priority), row.getString("organization_id"),
                JsonColumns.read(row.getString("data")), delivery);
    }
}
