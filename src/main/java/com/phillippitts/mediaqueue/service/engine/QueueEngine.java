package com.phillippitts.mediaqueue.service.engine;

import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.JobStatus;
import com.phillippitts.mediaqueue.domain.OutboxSnapshot;
import com.phillippitts.mediaqueue.domain.QueueSummary;
import com.phillippitts.mediaqueue.domain.RunResult;
import com.phillippitts.mediaqueue.domain.SidecarPaths;
import com.phillippitts.mediaqueue.exception.InvalidJobException;
import com.phillippitts.mediaqueue.service.events.JobFinishedEvent;
import com.phillippitts.mediaqueue.service.outbox.IngestOutbox;
import com.phillippitts.mediaqueue.service.outbox.IngestProcessor;
import com.phillippitts.mediaqueue.service.persistence.QueuePersistence;
import com.phillippitts.mediaqueue.service.runner.CommandRunner;
import com.phillippitts.mediaqueue.service.sidecar.SidecarResolver;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Owns the job list and drives sequential execution.
 *
 * <p><b>State ownership:</b> every read and write of the job list happens under one
 * {@link ReentrantLock}. Process execution happens on the runner's executor; its result is
 * handed back on the single-thread engine executor, which re-acquires the lock and applies the
 * result only when it still belongs to the current run.
 *
 * <p><b>Execution:</b> at most one job is RUNNING. {@link #start()} picks the oldest PENDING job;
 * each result advances to the next until none remain. {@link #stop()} cancels the running job and
 * every pending job, and the engine stays idle until {@code start()} is called again.
 *
 * <p><b>Side effects:</b> a successful job's sidecar is finalized and its source file handed to the
 * {@link IngestOutbox} exactly once. Failed and canceled runs only clean up their temp file.
 */
@Service
public class QueueEngine {

    private static final Logger LOG = LogManager.getLogger(QueueEngine.class);

    /** Fixed reason attached to jobs canceled by {@link #stop()}. */
    public static final String CANCELED_REASON = "Canceled by user";

    private final CommandRunner runner;
    private final SidecarResolver sidecarResolver;
    private final QueuePersistence persistence;
    private final IngestOutbox outbox;
    private final IngestProcessor processor;
    private final Executor engineExecutor;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private final Lock lock = new ReentrantLock();
    private final List<Job> jobs = new ArrayList<>();
    private final Set<UUID> handedOff = new HashSet<>();
    private ActiveRun activeRun;
    private long runSequence;
    private boolean stopped;

    /**
     * A dispatched run. The token distinguishes a resumed job's new run from a late result of
     * its canceled one.
     */
    private record ActiveRun(UUID jobId, long token, SidecarPaths paths) {}

    public QueueEngine(CommandRunner runner,
                       SidecarResolver sidecarResolver,
                       QueuePersistence persistence,
                       IngestOutbox outbox,
                       IngestProcessor processor,
                       @Qualifier("engineExecutor") Executor engineExecutor,
                       Clock clock,
                       ApplicationEventPublisher publisher) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.sidecarResolver = Objects.requireNonNull(sidecarResolver, "sidecarResolver");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.outbox = Objects.requireNonNull(outbox, "outbox");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.engineExecutor = Objects.requireNonNull(engineExecutor, "engineExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");

        List<Job> restored = persistence.load();
        jobs.addAll(restored);
        if (!restored.isEmpty()) {
            LOG.info("Restored {} jobs ({})", restored.size(), QueueSummary.of(restored));
        }
        // Leftover outbox entries from the previous session
        processor.kick();
    }

    /**
     * Appends {@code newJobs} in order and persists. Does not start execution.
     *
     * @throws InvalidJobException if a job is not PENDING or its id is already queued;
     *                             nothing is appended in that case
     */
    public void enqueue(List<Job> newJobs) {
        Objects.requireNonNull(newJobs, "newJobs");
        lock.lock();
        try {
            Set<UUID> ids = new HashSet<>();
            jobs.forEach(j -> ids.add(j.id()));
            for (Job job : newJobs) {
                if (job.status() != JobStatus.PENDING) {
                    throw new InvalidJobException(job.id(), "expected pending but was " + job.status().wireName());
                }
                if (!ids.add(job.id())) {
                    throw new InvalidJobException(job.id(), "duplicate id");
                }
            }
            if (newJobs.isEmpty()) {
                return;
            }
            jobs.addAll(newJobs);
            persistLocked();
            LOG.info("Enqueued {} jobs ({})", newJobs.size(), QueueSummary.of(jobs));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Begins sequential execution. No-op when a job is running or nothing is pending.
     */
    public void start() {
        Dispatch dispatch;
        lock.lock();
        try {
            stopped = false;
            dispatch = prepareNextLocked();
            if (dispatch != null) {
                LOG.info("Queue started ({})", QueueSummary.of(jobs));
            }
        } finally {
            lock.unlock();
        }
        launch(dispatch);
    }

    /**
     * Cancels the running job and every pending job. Returns without waiting for the process.
     */
    public void stop() {
        Job canceledRun = null;
        Path tempToClean = null;
        int canceledPending = 0;
        lock.lock();
        try {
            stopped = true;
            Instant now = clock.instant();
            for (int i = 0; i < jobs.size(); i++) {
                Job job = jobs.get(i);
                if (job.status() == JobStatus.PENDING) {
                    jobs.set(i, job.toCanceled(CANCELED_REASON, now));
                    canceledPending++;
                } else if (job.status() == JobStatus.RUNNING) {
                    canceledRun = job.toCanceled(CANCELED_REASON, now);
                    jobs.set(i, canceledRun);
                }
            }
            if (activeRun != null) {
                tempToClean = activeRun.paths().tempPath();
                activeRun = null;
            }
            persistLocked();
            // Under the lock so the cancel cannot reach a run submitted by a later start
            runner.cancelRunning();
        } finally {
            lock.unlock();
        }
        LOG.info("Queue stopped: canceled {} pending job(s){}", canceledPending,
                canceledRun == null ? "" : " and the running job");
        sidecarResolver.cleanupTemp(tempToClean);
        if (canceledRun != null) {
            publish(canceledRun);
        }
    }

    /**
     * Moves every CANCELED job back to PENDING with error and attempts cleared. Does not start.
     *
     * @return number of jobs resumed
     */
    public int resumeCanceled() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int resumed = 0;
            for (int i = 0; i < jobs.size(); i++) {
                Job job = jobs.get(i);
                if (job.status() == JobStatus.CANCELED) {
                    jobs.set(i, job.toResumed(now));
                    resumed++;
                }
            }
            if (resumed > 0) {
                persistLocked();
                LOG.info("Resumed {} canceled job(s)", resumed);
            }
            return resumed;
        } finally {
            lock.unlock();
        }
    }

    /** Removes DONE jobs. */
    public int clearCompleted() {
        return removeWhere(j -> j.status() == JobStatus.DONE);
    }

    /** Removes CANCELED and FAILED jobs. */
    public int clearCanceledFailed() {
        return removeWhere(j -> j.status() == JobStatus.CANCELED || j.status() == JobStatus.FAILED);
    }

    /** Removes every job except the running one. */
    public int clearAll() {
        return removeWhere(j -> j.status() != JobStatus.RUNNING);
    }

    /**
     * Removes one job unless it is running.
     *
     * @return {@code true} if the job was removed
     */
    public boolean remove(UUID jobId) {
        return removeWhere(j -> j.id().equals(jobId) && j.status() != JobStatus.RUNNING) > 0;
    }

    /**
     * {@link #clearAll()} plus dropping every outbox entry.
     */
    public void resetAll() {
        clearAll();
        outbox.reset();
        LOG.info("Queue and ingest outbox reset");
    }

    public List<Job> jobs() {
        lock.lock();
        try {
            return List.copyOf(jobs);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Job> job(UUID jobId) {
        lock.lock();
        try {
            return jobs.stream().filter(j -> j.id().equals(jobId)).findFirst();
        } finally {
            lock.unlock();
        }
    }

    public QueueSummary summary() {
        lock.lock();
        try {
            return QueueSummary.of(jobs);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return activeRun != null;
        } finally {
            lock.unlock();
        }
    }

    public int ingestPendingCount() {
        return outbox.snapshot().pending();
    }

    public int ingestErrorCount() {
        return outbox.snapshot().errors();
    }

    public OutboxSnapshot ingestSnapshot() {
        return outbox.snapshot();
    }

    private int removeWhere(Predicate<Job> predicate) {
        lock.lock();
        try {
            List<UUID> removed = new ArrayList<>();
            jobs.removeIf(j -> {
                if (predicate.test(j)) {
                    removed.add(j.id());
                    return true;
                }
                return false;
            });
            if (!removed.isEmpty()) {
                removed.forEach(handedOff::remove);
                persistLocked();
                LOG.debug("Removed {} job(s) ({})", removed.size(), QueueSummary.of(jobs));
            }
            return removed.size();
        } finally {
            lock.unlock();
        }
    }

    /** A job marked RUNNING and submitted to the runner under the lock, awaiting its result. */
    private record Dispatch(Job job, ActiveRun run, CompletableFuture<RunResult> future) {}

    private Dispatch prepareNextLocked() {
        if (stopped || activeRun != null) {
            return null;
        }
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            if (job.status() != JobStatus.PENDING) {
                continue;
            }
            Instant now = clock.instant();
            SidecarPaths paths = sidecarResolver.ensureSidecar(job);
            Job running = job.withSidecarPath(paths.finalPath(), now).toRunning(now);
            jobs.set(i, running);
            activeRun = new ActiveRun(running.id(), ++runSequence, paths);
            persistLocked();
            return new Dispatch(running, activeRun, submitLocked(running));
        }
        return null;
    }

    /**
     * Hands the job to the runner while the lock is held, so a concurrent {@link #stop()} either
     * precedes the submission or cancels it.
     */
    private CompletableFuture<RunResult> submitLocked(Job job) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("jobId", job.id().toString())) {
            LOG.debug("Running {} (attempt {})", job.displayName(), job.attempts());
        }
        try {
            return runner.run(job);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(RunResult.spawnFailure(e.toString()));
        }
    }

    private void launch(Dispatch dispatch) {
        if (dispatch == null) {
            return;
        }
        dispatch.future().exceptionally(t -> RunResult.spawnFailure(t.getMessage() == null ? t.toString() : t.getMessage()))
                .thenAcceptAsync(result -> onResult(dispatch.run(), result), engineExecutor);
    }

    private void onResult(ActiveRun run, RunResult result) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("jobId", run.jobId().toString())) {
            applyResult(run, result);
        }
    }

    private void applyResult(ActiveRun run, RunResult result) {
        Job finished = null;
        boolean handOff = false;
        boolean stale;
        Dispatch next;
        lock.lock();
        try {
            stale = !run.equals(activeRun);
            if (!stale) {
                activeRun = null;
                int index = indexOf(run.jobId());
                Job job = index < 0 ? null : jobs.get(index);
                if (job != null && job.status() == JobStatus.RUNNING) {
                    Instant now = clock.instant();
                    if (result.isSuccess()) {
                        sidecarResolver.finalizeSidecar(run.paths().tempPath(), run.paths().finalPath());
                        finished = job.toDone(now);
                        handOff = handedOff.add(job.id());
                    } else {
                        finished = job.toFailed(result.failureReason(), now);
                    }
                    jobs.set(index, finished);
                    persistLocked();
                    if (handOff) {
                        // Before unlocking: a persisted DONE job always has its outbox entry
                        outbox.enqueue(finished.sourceFile(), finished.id());
                    }
                } else {
                    stale = true;
                }
            }
            next = prepareNextLocked();
        } finally {
            lock.unlock();
        }

        if (stale) {
            LOG.debug("Discarding result of canceled run (exit {})", result.exitCode());
            sidecarResolver.cleanupTemp(run.paths().tempPath());
        } else if (finished.status() == JobStatus.FAILED) {
            sidecarResolver.cleanupTemp(run.paths().tempPath());
            LOG.debug("Job {} failed: {}", finished.displayName(), finished.errorMessage());
        } else {
            LOG.debug("Job {} done", finished.displayName());
        }
        if (handOff) {
            processor.kick();
        }
        if (finished != null) {
            publish(finished);
        }
        if (next == null && !stale) {
            LOG.info("Queue idle ({})", summary());
        }
        launch(next);
    }

    private int indexOf(UUID jobId) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(jobId)) {
                return i;
            }
        }
        return -1;
    }

    private void persistLocked() {
        persistence.save(List.copyOf(jobs));
    }

    private void publish(Job job) {
        try {
            publisher.publishEvent(JobFinishedEvent.of(job));
        } catch (RuntimeException e) {
            LOG.warn("Job event listener failed: {}", e.toString());
        }
    }
}
