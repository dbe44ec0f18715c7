package com.phillippitts.mediaqueue.config;

import com.phillippitts.mediaqueue.service.engine.QueueEngine;
import com.phillippitts.mediaqueue.service.outbox.IngestOutbox;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Gauges for queue and outbox sizes.
 *
 * <ul>
 *   <li>mediaqueue.jobs.pending / mediaqueue.jobs.running</li>
 *   <li>mediaqueue.outbox.pending / mediaqueue.outbox.errors / mediaqueue.outbox.abandoned</li>
 * </ul>
 *
 * <p>Additionally logs a queue summary every 5 minutes for operational visibility.
 */
@Configuration
public class QueueMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(QueueMetricsConfig.class);

    private final ObjectProvider<QueueEngine> engineProvider;
    private final ObjectProvider<IngestOutbox> outboxProvider;

    public QueueMetricsConfig(ObjectProvider<QueueEngine> engineProvider,
                              ObjectProvider<IngestOutbox> outboxProvider) {
        this.engineProvider = engineProvider;
        this.outboxProvider = outboxProvider;
    }

    @Bean
    public MeterBinder queueGauges() {
        return registry -> {
            QueueEngine engine = engineProvider.getObject();
            IngestOutbox outbox = outboxProvider.getObject();

            Gauge.builder("mediaqueue.jobs.pending", engine, e -> e.summary().pending())
                    .description("Jobs waiting to run")
                    .register(registry);
            Gauge.builder("mediaqueue.jobs.running", engine, e -> e.summary().running())
                    .description("Jobs currently running")
                    .register(registry);
            Gauge.builder("mediaqueue.outbox.pending", outbox, o -> o.snapshot().pending())
                    .description("Entries waiting to be ingested")
                    .register(registry);
            Gauge.builder("mediaqueue.outbox.errors", outbox, o -> o.snapshot().errors())
                    .description("Outbox entries that failed at least once")
                    .register(registry);
            Gauge.builder("mediaqueue.outbox.abandoned", outbox, o -> o.snapshot().abandoned())
                    .description("Outbox entries no longer retried")
                    .register(registry);

            LOG.info("Queue metrics registered: mediaqueue.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logQueueHealth() {
        QueueEngine engine = engineProvider.getObject();
        IngestOutbox outbox = outboxProvider.getObject();
        LOG.info("Queue health: {}, running={}, outbox={}", engine.summary(), engine.isRunning(), outbox.snapshot());
    }
}
