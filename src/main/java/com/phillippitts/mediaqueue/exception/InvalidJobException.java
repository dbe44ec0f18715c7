package com.phillippitts.mediaqueue.exception;

import java.util.UUID;

/**
 * Thrown when a job cannot be enqueued: it is not pending, or its id is already queued.
 */
public class InvalidJobException extends MediaQueueException {

    private final UUID jobId;

    public InvalidJobException(UUID jobId, String reason) {
        super("Invalid job " + jobId + ": " + reason);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
