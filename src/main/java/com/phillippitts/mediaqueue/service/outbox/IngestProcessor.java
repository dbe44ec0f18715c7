package com.phillippitts.mediaqueue.service.outbox;

import com.phillippitts.mediaqueue.domain.OutboxEntry;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the {@link IngestOutbox} into the {@link IngestSink}.
 *
 * <p>At most one drain runs at a time. A {@link #kick()} that lands while a drain is in progress
 * requests one more pass, so entries enqueued mid-drain are never stranded. Each pass ends when
 * no entry is eligible and then notifies the {@link IngestPassListener} exactly once.
 */
@Component
public class IngestProcessor {

    private static final Logger LOG = LogManager.getLogger(IngestProcessor.class);

    private final IngestOutbox outbox;
    private final IngestSink sink;
    private final Executor executor;
    private final IngestPassListener passListener;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean kickPending = new AtomicBoolean(false);

    public IngestProcessor(IngestOutbox outbox,
                           IngestSink sink,
                           @Qualifier("ingestExecutor") Executor executor,
                           IngestPassListener passListener) {
        this.outbox = Objects.requireNonNull(outbox, "outbox");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.passListener = passListener == null ? IngestPassListener.NO_OP : passListener;
    }

    /**
     * Requests a drain. Returns immediately; the drain runs on the ingest executor.
     */
    public void kick() {
        kickPending.set(true);
        scheduleDrain();
    }

    /**
     * Periodic sweep so entries waiting out their backoff get retried without a new enqueue.
     */
    @Scheduled(fixedDelayString = "${queue.outbox.retry-interval-millis:5000}",
            initialDelayString = "${queue.outbox.retry-interval-millis:5000}")
    public void sweep() {
        if (outbox.hasEligible()) {
            LOG.debug("Retry sweep found eligible outbox entries");
            kick();
        }
    }

    public boolean isDraining() {
        return draining.get();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drainLoop);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            LOG.warn("Ingest executor rejected drain request: {}", e.getMessage());
        }
    }

    private void drainLoop() {
        try {
            while (kickPending.getAndSet(false)) {
                drainOnce();
            }
        } finally {
            draining.set(false);
        }
        // A kick may have landed between the last check and releasing the flag
        if (kickPending.get()) {
            scheduleDrain();
        }
    }

    private void drainOnce() {
        int succeeded = 0;
        int failed = 0;
        Optional<OutboxEntry> next;
        while ((next = outbox.nextPending()).isPresent()) {
            OutboxEntry entry = next.get();
            if (ingest(entry)) {
                outbox.markSuccess(entry.id());
                succeeded++;
            } else {
                failed++;
            }
        }
        if (succeeded + failed > 0) {
            LOG.info("Ingest pass finished: {} succeeded, {} failed", succeeded, failed);
        }
        notifyListener(new IngestPassListener.PassStats(succeeded, failed));
    }

    private boolean ingest(OutboxEntry entry) {
        String jobId = entry.jobId() == null ? "" : entry.jobId().toString();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("jobId", jobId)) {
            try {
                if (sink.ingest(entry.filePath(), entry.jobId())) {
                    LOG.debug("Ingested {}", entry.filePath());
                    return true;
                }
                outbox.markFailure(entry.id(), "Ingest failed");
            } catch (RuntimeException e) {
                outbox.markFailure(entry.id(), e.getMessage() == null ? e.toString() : e.getMessage());
            }
            return false;
        }
    }

    private void notifyListener(IngestPassListener.PassStats stats) {
        try {
            passListener.onPass(stats);
        } catch (RuntimeException e) {
            LOG.warn("Ingest pass listener failed: {}", e.toString());
        }
    }
}
