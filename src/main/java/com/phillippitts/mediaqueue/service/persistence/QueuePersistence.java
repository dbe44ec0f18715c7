package com.phillippitts.mediaqueue.service.persistence;

import com.phillippitts.mediaqueue.domain.Job;

import java.util.List;

/**
 * Durable mirror of the job set used for crash recovery.
 *
 * <p>Both operations absorb I/O errors: the in-memory queue stays correct for the current
 * session even when the snapshot cannot be written.
 */
public interface QueuePersistence {

    /** Fixed reason attached to jobs that were running when the previous process exited. */
    String INTERRUPTED_REASON = "Interrupted during previous session";

    /**
     * Replaces the stored snapshot with {@code jobs}. Failures are logged and swallowed.
     */
    void save(List<Job> jobs);

    /**
     * Reads the stored snapshot. Jobs stored as running come back failed with
     * {@link #INTERRUPTED_REASON}. Missing, unreadable or malformed input yields an empty list.
     */
    List<Job> load();
}
