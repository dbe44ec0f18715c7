package com.phillippitts.mediaqueue.service.health;

import com.phillippitts.mediaqueue.domain.OutboxSnapshot;
import com.phillippitts.mediaqueue.domain.QueueSummary;
import com.phillippitts.mediaqueue.service.engine.QueueEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the job queue and its ingestion outbox.
 *
 * <ul>
 *   <li>UP: queue operating, every outbox entry still retryable</li>
 *   <li>DEGRADED: at least one outbox entry was abandoned after repeated ingest failures</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class QueueHealthIndicator implements HealthIndicator {

    private final QueueEngine engine;

    public QueueHealthIndicator(QueueEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        QueueSummary summary = engine.summary();
        OutboxSnapshot outbox = engine.ingestSnapshot();

        Health.Builder builder = outbox.abandoned() > 0
                ? new Health.Builder().status("DEGRADED").withDetail("status", "Ingest entries abandoned")
                : new Health.Builder().up().withDetail("status", "Queue operational");

        return builder
                .withDetail("running", engine.isRunning())
                .withDetail("jobs", summary.toString())
                .withDetail("ingestPending", outbox.pending())
                .withDetail("ingestErrors", outbox.errors())
                .withDetail("ingestAbandoned", outbox.abandoned())
                .build();
    }
}
