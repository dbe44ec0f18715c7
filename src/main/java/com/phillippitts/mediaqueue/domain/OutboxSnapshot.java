package com.phillippitts.mediaqueue.domain;

/**
 * Point-in-time outbox counters.
 *
 * @param pending   entries still in the outbox (including abandoned ones)
 * @param errors    entries carrying a last error
 * @param abandoned entries at the attempt limit
 */
public record OutboxSnapshot(int pending, int errors, int abandoned) {

    public static final OutboxSnapshot EMPTY = new OutboxSnapshot(0, 0, 0);
}
