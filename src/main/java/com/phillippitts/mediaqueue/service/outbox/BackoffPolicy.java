package com.phillippitts.mediaqueue.service.outbox;

import java.time.Duration;

/**
 * Delay enforced after an ingestion failure before the entry becomes eligible again.
 */
public enum BackoffPolicy {

    /** Same window after every failure. */
    FIXED {
        @Override
        public Duration delay(int attempts, Duration window, Duration cap) {
            return window;
        }
    },

    /** {@code window * 2^attempts}, bounded by {@code cap}. */
    EXPONENTIAL {
        @Override
        public Duration delay(int attempts, Duration window, Duration cap) {
            int shift = Math.min(Math.max(attempts, 0), 30);
            long millis = window.toMillis() * (1L << shift);
            return millis >= cap.toMillis() ? cap : Duration.ofMillis(millis);
        }
    };

    /**
     * @param attempts failures recorded so far (at least 1 when a delay applies)
     * @param window   fixed window, or base unit for exponential growth
     * @param cap      upper bound for growing delays
     * @return minimum time between the last failure and the next attempt
     */
    public abstract Duration delay(int attempts, Duration window, Duration cap);
}
