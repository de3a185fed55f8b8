package com.safee.jobs.scheduler.api;

import com.safee.jobs.store.JobPriority;
import com.safee.jobs.store.JobStats;
import com.safee.jobs.store.JobStatus;
import com.safee.jobs.store.JobType;

import java.util.LinkedHashMap;
import java.util.Map;

/** Stats keyed by wire values rather than enum constant names. */
public class JobStatsResponse {
    private final long total;
    private final Map<String, Long> byStatus = new LinkedHashMap<>();
    private final Map<String, Long> byType = new LinkedHashMap<>();
    private final Map<String, Long> byPriority = new LinkedHashMap<>();

    public JobStatsResponse(JobStats stats) {
        this.total = stats.getTotal();
        for (Map.Entry<JobStatus, Long> e : stats.getByStatus().entrySet()) {
            byStatus.put(e.getKey().getValue(), e.getValue());
        }
        for (Map.Entry<JobType, Long> e : stats.getByType().entrySet()) {
            byType.put(e.getKey().getValue(), e.getValue());
        }
        for (Map.Entry<JobPriority, Long> e : stats.getByPriority().entrySet()) {
            byPriority.put(e.getKey().getValue(), e.getValue());
        }
    }

    public long getTotal() {
        return total;
    }

    public Map<String, Long> getByStatus() {
        return byStatus;
    }

    public Map<String, Long> getByType() {
        return byType;
    }

    public Map<String, Long> getByPriority() {
        return byPriority;
    }
}
