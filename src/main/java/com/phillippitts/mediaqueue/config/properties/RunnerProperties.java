package com.phillippitts.mediaqueue.config.properties;

import com.phillippitts.mediaqueue.util.ProcessTimeouts;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the external analysis command runner.
 * Binds to properties prefixed with "queue.runner".
 *
 * @param gracefulShutdownMillis delay between the polite termination signal and a forced kill
 * @param timeoutSeconds         per-run limit; 0 disables the limit
 * @param maxOutputBytes         cap for each captured stream (stdout, stderr)
 */
@ConfigurationProperties(prefix = "queue.runner")
@Validated
public record RunnerProperties(
        @Positive(message = "Graceful shutdown must be positive") @DefaultValue("500")
        long gracefulShutdownMillis,

        @PositiveOrZero(message = "Timeout must not be negative") @DefaultValue("0")
        int timeoutSeconds,

        @Positive(message = "Max output bytes must be positive") @DefaultValue("1048576")
        int maxOutputBytes
) {

    public static RunnerProperties defaults() {
        return new RunnerProperties(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), 0, 1_048_576);
    }

    public Duration gracefulShutdown() {
        return Duration.ofMillis(gracefulShutdownMillis);
    }

    public boolean hasTimeout() {
        return timeoutSeconds > 0;
    }
}
