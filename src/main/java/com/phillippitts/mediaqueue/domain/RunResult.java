package com.phillippitts.mediaqueue.domain;

import com.phillippitts.mediaqueue.util.LogSanitizer;

/**
 * Outcome of one execution of a job's prepared command.
 *
 * <p>A spawn failure (missing executable, permission denied, empty command) is carried in
 * {@code spawnError} instead of being thrown; callers treat it like a non-zero exit.
 *
 * @param exitCode   process exit code, or -1 when the process never ran to completion
 * @param stdout     captured standard output (possibly truncated)
 * @param stderr     captured standard error (possibly truncated)
 * @param spawnError reason the process could not be started, or {@code null}
 */
public record RunResult(int exitCode, String stdout, String stderr, String spawnError) {

    /** Maximum length of a failure reason attached to a job. */
    public static final int MAX_REASON_CHARS = 500;

    public RunResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static RunResult exited(int exitCode, String stdout, String stderr) {
        return new RunResult(exitCode, stdout, stderr, null);
    }

    public static RunResult spawnFailure(String reason) {
        return new RunResult(-1, "", "", reason);
    }

    public boolean isSuccess() {
        return exitCode == 0 && spawnError == null;
    }

    /**
     * Short reason for a failed run: the spawn error, else trimmed stderr, else {@code exit <code>}.
     */
    public String failureReason() {
        if (spawnError != null) {
            return LogSanitizer.truncate(spawnError, MAX_REASON_CHARS);
        }
        String err = stderr.trim();
        if (!err.isEmpty()) {
            return LogSanitizer.truncate(err, MAX_REASON_CHARS);
        }
        return "exit " + exitCode;
    }
}
