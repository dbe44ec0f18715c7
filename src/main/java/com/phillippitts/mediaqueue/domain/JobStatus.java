package com.phillippitts.mediaqueue.domain;

import java.util.Locale;

/**
 * Lifecycle status of a queued job.
 *
 * <p>Transitions:
 * <pre>
 * PENDING → RUNNING → DONE | FAILED
 * PENDING → CANCELED
 * RUNNING → CANCELED   (via stop)
 * CANCELED → PENDING   (via resume)
 * </pre>
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    CANCELED;

    /**
     * Returns {@code true} for statuses that only change through an explicit caller action.
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELED;
    }

    /**
     * Progress fraction shown for a job in this status: 0.0 pending, 0.5 running, 1.0 terminal.
     */
    public double progress() {
        return switch (this) {
            case PENDING -> 0.0;
            case RUNNING -> 0.5;
            case DONE, FAILED, CANCELED -> 1.0;
        };
    }

    /** Lowercase name used in the persisted snapshot. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a persisted status name.
     *
     * @throws IllegalArgumentException if the name is not a known status
     */
    public static JobStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Job status must not be null");
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
