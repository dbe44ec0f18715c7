package com.phillippitts.mediaqueue.service.metrics;

import com.phillippitts.mediaqueue.domain.JobStatus;
import com.phillippitts.mediaqueue.service.outbox.IngestPassListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for job execution and ingestion.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Finished jobs per outcome (done, failed, canceled) and their run time</li>
 *   <li>Ingest successes and failures, fed once per drain pass</li>
 *   <li>Number of drain passes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class QueueMetrics implements IngestPassListener {

    static final String METRIC_PREFIX = "mediaqueue";

    private final MeterRegistry registry;
    private final Counter ingestSuccess;
    private final Counter ingestFailure;
    private final Counter ingestPasses;

    public QueueMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.ingestSuccess = Counter.builder(METRIC_PREFIX + ".ingest.success")
                .description("Number of files handed to the ingest sink successfully")
                .register(registry);
        this.ingestFailure = Counter.builder(METRIC_PREFIX + ".ingest.failure")
                .description("Number of failed ingest attempts")
                .register(registry);
        this.ingestPasses = Counter.builder(METRIC_PREFIX + ".ingest.passes")
                .description("Number of outbox drain passes")
                .register(registry);
    }

    /**
     * Records a job reaching a terminal status.
     *
     * @param status   terminal status
     * @param duration time the job spent running
     */
    public void recordJobFinished(JobStatus status, Duration duration) {
        String outcome = status.wireName();
        Counter.builder(METRIC_PREFIX + ".jobs.completed")
                .description("Number of jobs that reached a terminal status")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".jobs.duration")
                .description("Time jobs spent running")
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    @Override
    public void onPass(PassStats stats) {
        ingestPasses.increment();
        if (stats.succeeded() > 0) {
            ingestSuccess.increment(stats.succeeded());
        }
        if (stats.failed() > 0) {
            ingestFailure.increment(stats.failed());
        }
    }
}
