package com.phillippitts.mediaqueue.domain;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-status job counts.
 */
public record QueueSummary(int pending, int running, int done, int failed, int canceled) {

    public static QueueSummary of(Collection<Job> jobs) {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (Job job : jobs) {
            counts.merge(job.status(), 1, Integer::sum);
        }
        return new QueueSummary(
                counts.getOrDefault(JobStatus.PENDING, 0),
                counts.getOrDefault(JobStatus.RUNNING, 0),
                counts.getOrDefault(JobStatus.DONE, 0),
                counts.getOrDefault(JobStatus.FAILED, 0),
                counts.getOrDefault(JobStatus.CANCELED, 0));
    }

    public int total() {
        return pending + running + done + failed + canceled;
    }

    @Override
    public String toString() {
        return "pending=" + pending + " running=" + running + " done=" + done
                + " failed=" + failed + " canceled=" + canceled;
    }
}
