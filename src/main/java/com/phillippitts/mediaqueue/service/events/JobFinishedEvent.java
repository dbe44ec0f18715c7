package com.phillippitts.mediaqueue.service.events;

import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a started job reaches DONE, FAILED or CANCELED.
 *
 * @param jobId        job identifier
 * @param status       terminal status
 * @param errorMessage failure or cancellation reason, {@code null} for DONE
 * @param duration     time spent running
 * @param finishedAt   when the status was applied
 */
public record JobFinishedEvent(
        UUID jobId,
        JobStatus status,
        String errorMessage,
        Duration duration,
        Instant finishedAt
) {

    public static JobFinishedEvent of(Job job) {
        Instant finished = job.finishedAt() == null ? job.updatedAt() : job.finishedAt();
        Duration duration = job.startedAt() == null ? Duration.ZERO : Duration.between(job.startedAt(), finished);
        return new JobFinishedEvent(job.id(), job.status(), job.errorMessage(),
                duration.isNegative() ? Duration.ZERO : duration, finished);
    }
}
