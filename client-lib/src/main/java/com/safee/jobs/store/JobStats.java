package com.safee.jobs.store;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate job counts. Every enum constant has a bucket, zero when nothing matched.
 */
public class JobStats {
    private final long total;
    private final Map<JobStatus, Long> byStatus;
    private final Map<JobType, Long> byType;
    private final Map<JobPriority, Long> byPriority;

    public JobStats(long total, Map<JobStatus, Long> byStatus, Map<JobType, Long> byType,
                    Map<JobPriority, Long> byPriority) {
        this.total = total;
        this.byStatus = Collections.unmodifiableMap(fill(JobStatus.class, byStatus));
        this.byType = Collections.unmodifiableMap(fill(JobType.class, byType));
        this.byPriority = Collections.unmodifiableMap(fill(JobPriority.class, byPriority));
    }

    private static <E extends Enum<E>> Map<E, Long> fill(Class<E> type, Map<E, Long> counts) {
        Map<E, Long> out = new EnumMap<>(type);
        for (E constant : type.getEnumConstants()) {
            Long count = counts == null ? null : counts.get(constant);
            out.put(constant, count == null ? 0L : count);
        }
        return out;
    }

    public long getTotal() {
        return total;
    }

    public Map<JobStatus, Long> getByStatus() {
        return byStatus;
    }

    public Map<JobType, Long> getByType() {
        return byType;
    }

    public Map<JobPriority, Long> getByPriority() {
        return byPriority;
    }
}
