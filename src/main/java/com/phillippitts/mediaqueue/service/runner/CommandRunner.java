package com.phillippitts.mediaqueue.service.runner;

import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.RunResult;

import java.util.concurrent.CompletableFuture;

/**
 * Executes a job's prepared command.
 *
 * <p>Implementations never complete the future exceptionally for process problems: spawn
 * failures, non-zero exits and timeouts are all reported through {@link RunResult}.
 */
public interface CommandRunner {

    /**
     * Starts {@code job.preparedCommand()} and completes when the process exits, is canceled or
     * cannot be started.
     */
    CompletableFuture<RunResult> run(Job job);

    /**
     * Asks the running process (if any) to terminate and escalates to a forced kill after a short
     * grace period. Returns without waiting for the process to exit.
     */
    void cancelRunning();
}
