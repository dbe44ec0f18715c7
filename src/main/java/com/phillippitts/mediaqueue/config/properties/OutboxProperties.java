package com.phillippitts.mediaqueue.config.properties;

import com.phillippitts.mediaqueue.service.outbox.BackoffPolicy;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Retry policy for the ingestion outbox.
 * Binds to properties prefixed with "queue.outbox".
 *
 * @param maxAttempts         failures after which an entry is abandoned in place
 * @param backoffMode         FIXED window or EXPONENTIAL growth
 * @param backoffWindowMillis fixed window (FIXED) or base unit (EXPONENTIAL)
 * @param backoffCapMillis    upper bound for EXPONENTIAL delays
 * @param retryIntervalMillis period of the background retry sweep
 */
@ConfigurationProperties(prefix = "queue.outbox")
@Validated
public record OutboxProperties(
        @Positive @DefaultValue("5")
        int maxAttempts,

        @NotNull @DefaultValue("FIXED")
        BackoffPolicy backoffMode,

        @Positive @DefaultValue("2000")
        long backoffWindowMillis,

        @Positive @DefaultValue("60000")
        long backoffCapMillis,

        @Positive @DefaultValue("5000")
        long retryIntervalMillis
) {

    public static OutboxProperties defaults() {
        return new OutboxProperties(5, BackoffPolicy.FIXED, 2000, 60_000, 5000);
    }

    /**
     * Delay that must elapse after the {@code attempts}-th failure before the next try.
     */
    public Duration backoffAfter(int attempts) {
        return backoffMode.delay(attempts, Duration.ofMillis(backoffWindowMillis),
                Duration.ofMillis(backoffCapMillis));
    }
}
