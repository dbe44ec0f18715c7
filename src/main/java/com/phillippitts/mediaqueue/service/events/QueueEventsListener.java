package com.phillippitts.mediaqueue.service.events;

import com.phillippitts.mediaqueue.domain.JobStatus;
import com.phillippitts.mediaqueue.service.metrics.QueueMetrics;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs finished jobs and feeds {@link QueueMetrics}.
 */
@Component
public class QueueEventsListener {

    private static final Logger LOG = LogManager.getLogger(QueueEventsListener.class);

    private final QueueMetrics metrics;

    public QueueEventsListener(QueueMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    public void onJobFinished(JobFinishedEvent event) {
        try (CloseableThreadContext.Instance ignored =
                     CloseableThreadContext.put("jobId", event.jobId().toString())) {
            if (event.status() == JobStatus.FAILED) {
                LOG.warn("Job failed after {} ms: {}", event.duration().toMillis(), event.errorMessage());
            } else {
                LOG.info("Job {} after {} ms", event.status().wireName(), event.duration().toMillis());
            }
        }
        metrics.recordJobFinished(event.status(), event.duration());
    }
}
