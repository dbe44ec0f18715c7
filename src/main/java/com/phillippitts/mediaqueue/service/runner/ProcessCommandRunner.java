package com.phillippitts.mediaqueue.service.runner;

import com.phillippitts.mediaqueue.config.properties.RunnerProperties;
import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.RunResult;
import com.phillippitts.mediaqueue.util.LogSanitizer;
import com.phillippitts.mediaqueue.util.ProcessTimeouts;
import com.phillippitts.mediaqueue.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a job's prepared command as a child process.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}, reporting spawn failures as results
 * - Capture stdout and stderr concurrently, each capped at {@code maxOutputBytes}
 * - Enforce the optional per-run timeout
 * - Cancel the current process with a polite signal, then a forced kill after the grace period
 *
 * <p>Processes are awaited on the runner executor; the kill escalation runs on a private
 * scheduler so {@link #cancelRunning()} never blocks its caller.
 *
 * <p>A cancel also applies to runs that are still queued or spawning: each run records the
 * cancel generation it was submitted under, and a run whose generation has moved on is either
 * skipped before spawning or terminated as soon as its process exists.
 */
@Component
public class ProcessCommandRunner implements CommandRunner, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ProcessCommandRunner.class);
    private static final int LOG_SNIPPET_CHARS = 200;
    static final String CANCELED_BEFORE_START = "Canceled before start";

    private final ProcessFactory processFactory;
    private final RunnerProperties properties;
    private final Executor executor;
    private final ScheduledExecutorService killScheduler;

    private final AtomicReference<Process> current = new AtomicReference<>();
    private final AtomicLong cancelGeneration = new AtomicLong();

    @Autowired
    public ProcessCommandRunner(RunnerProperties properties, @Qualifier("runnerExecutor") Executor executor) {
        this(new DefaultProcessFactory(), properties, executor);
    }

    ProcessCommandRunner(ProcessFactory processFactory, RunnerProperties properties, Executor executor) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.killScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "runner-kill");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<RunResult> run(Job job) {
        Objects.requireNonNull(job, "job");
        List<String> command = job.preparedCommand();
        if (command.isEmpty()) {
            return CompletableFuture.completedFuture(RunResult.spawnFailure("No command prepared"));
        }
        long generation = cancelGeneration.get();
        return CompletableFuture.supplyAsync(() -> execute(job, command, generation), executor);
    }

    @Override
    public void cancelRunning() {
        cancelGeneration.incrementAndGet();
        Process process = current.get();
        if (process == null || !process.isAlive()) {
            return;
        }
        LOG.info("Terminating running analysis process (pid {})", pidOf(process));
        terminate(process);
    }

    private RunResult execute(Job job, List<String> command, long generation) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("jobId", job.id().toString())) {
            long startTime = System.nanoTime();
            if (isCanceled(generation)) {
                LOG.debug("Run canceled before {} was started", command.get(0));
                return RunResult.exited(-1, "", CANCELED_BEFORE_START);
            }
            Process process;
            try {
                process = processFactory.start(command, null);
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to start {}: {}", command.get(0), e.getMessage());
                return RunResult.spawnFailure(e.getMessage() == null ? e.toString() : e.getMessage());
            }
            current.set(process);
            LOG.debug("Started {} for {}", command.get(0), job.sourceFile());
            if (isCanceled(generation)) {
                LOG.info("Run was canceled while {} was starting; terminating (pid {})",
                        command.get(0), pidOf(process));
                terminate(process);
            }

            StringBuffer stdout = new StringBuffer();
            StringBuffer stderr = new StringBuffer();
            Thread outGobbler = StreamGobbler.start(process.getInputStream(), stdout, "runner-out",
                    properties.maxOutputBytes());
            Thread errGobbler = StreamGobbler.start(process.getErrorStream(), stderr, "runner-err",
                    properties.maxOutputBytes());
            try {
                boolean timedOut = !waitFor(process);
                if (timedOut) {
                    LOG.warn("Process exceeded {}s timeout; terminating", properties.timeoutSeconds());
                    terminate(process);
                    process.waitFor();
                }
                joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
                joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

                if (timedOut) {
                    String reason = "Timeout after " + properties.timeoutSeconds() + "s";
                    String err = stderr.toString().trim();
                    return RunResult.exited(-1, stdout.toString(), err.isEmpty() ? reason : reason + "\n" + err);
                }
                int exitCode = process.exitValue();
                long elapsedMs = TimeUtils.elapsedMillis(startTime);
                if (exitCode == 0) {
                    LOG.debug("Process exited 0 in {} ms", elapsedMs);
                } else {
                    LOG.debug("Process exited {} in {} ms: {}", exitCode, elapsedMs,
                            LogSanitizer.singleLine(stderr.toString(), LOG_SNIPPET_CHARS));
                }
                return RunResult.exited(exitCode, stdout.toString(), stderr.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                terminate(process);
                return RunResult.exited(-1, stdout.toString(), "Interrupted while waiting for process");
            } finally {
                current.compareAndSet(process, null);
            }
        }
    }

    private boolean isCanceled(long generation) {
        return cancelGeneration.get() != generation;
    }

    private boolean waitFor(Process process) throws InterruptedException {
        if (!properties.hasTimeout()) {
            process.waitFor();
            return true;
        }
        return process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS);
    }

    /**
     * Sends the polite termination signal and schedules a forced kill after the grace period.
     */
    private void terminate(Process process) {
        try {
            process.destroy();
        } catch (RuntimeException e) {
            LOG.warn("Error signalling process: {}", e.toString());
        }
        Duration grace = properties.gracefulShutdown();
        try {
            killScheduler.schedule(() -> forceKill(process), grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            forceKill(process);
        }
    }

    private void forceKill(Process process) {
        if (!process.isAlive()) {
            return;
        }
        LOG.warn("Process {} ignored termination; forcing kill", pidOf(process));
        try {
            process.destroyForcibly();
            process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (process.isAlive()) {
                LOG.warn("Process still alive after destroyForcibly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    private static String pidOf(Process process) {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "?";
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Kills any running process and stops the kill scheduler. Idempotent.
     */
    @Override
    public void close() {
        Process process = current.getAndSet(null);
        if (process != null && process.isAlive()) {
            process.destroyForcibly();
        }
        killScheduler.shutdownNow();
    }
}
