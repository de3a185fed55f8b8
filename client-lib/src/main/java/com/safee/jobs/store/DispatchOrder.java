package com.safee.jobs.store;

import java.util.Comparator;

/**
 * The one ordering used to hand out work: priority rank ascending (critical first), then
 * scheduledFor ascending with unscheduled jobs last, then createdAt ascending (FIFO).
 * The SQL fragment and the comparator are both built from {@link JobPriority#rank()}.
 */
public final class DispatchOrder {

    public static final Comparator<Job> COMPARATOR = Comparator
            .comparingInt((Job job) -> job.getPriority().rank())
            .thenComparing(Job::getScheduledFor, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    static final String ORDER_BY_SQL = "ORDER BY " + priorityRankSql("priority")
            + " ASC, scheduled_for ASC NULLS LAST, created_at ASC";

    private DispatchOrder() {
    }

    /** CASE expression mapping a priority column to its rank. */
    public static String priorityRankSql(String column) {
        StringBuilder sql = new StringBuilder("CASE ").append(column);
        for (JobPriority priority : JobPriority.values()) {
            sql.append(" WHEN '").append(priority.getValue()).append("' THEN ").append(priority.rank());
        }
        return sql.append(" ELSE ").append(JobPriority.values().length).append(" END").toString();
    }
}
