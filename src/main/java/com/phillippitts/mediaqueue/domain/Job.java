package com.phillippitts.mediaqueue.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of queued analysis work.
 *
 * <p>Identity ({@code id}, {@code sourceFile}) and the execution plan ({@code preparedCommand},
 * {@code preparedOutputPath}) are fixed when the job is created so re-runs are deterministic.
 * Lifecycle state is changed by producing a new instance through the {@code to*} methods; only
 * {@link com.phillippitts.mediaqueue.service.engine.QueueEngine} does so for queued jobs.
 *
 * @param id                 stable unique identifier, never reused
 * @param sourceFile         media file to analyze
 * @param displayName        name shown to users (defaults to the file name)
 * @param group              folder grouping, or {@code null} for single-file drops
 * @param preparedCommand    fully resolved argument vector, executable first
 * @param preparedOutputPath final output path prepared at creation, or {@code null}
 * @param status             lifecycle status
 * @param sidecarPath        resolved final output path, assigned when the job starts
 * @param errorMessage       human-readable reason for failed/canceled jobs
 * @param attempts           number of times the job entered RUNNING
 * @param createdAt          creation time
 * @param updatedAt          last lifecycle change
 * @param startedAt          when the current attempt started, or {@code null}
 * @param finishedAt         when the job reached a terminal status, or {@code null}
 */
public record Job(
        UUID id,
        Path sourceFile,
        String displayName,
        JobGroup group,
        List<String> preparedCommand,
        Path preparedOutputPath,
        JobStatus status,
        Path sidecarPath,
        String errorMessage,
        int attempts,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt
) {

    public Job {
        Objects.requireNonNull(id, "Job id must not be null");
        Objects.requireNonNull(sourceFile, "Source file must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (displayName == null || displayName.isBlank()) {
            displayName = fileName(sourceFile);
        }
        preparedCommand = preparedCommand == null ? List.of() : List.copyOf(preparedCommand);
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts must not be negative, got: " + attempts);
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Creates a new pending job with a fresh id.
     */
    public static Job pending(Path sourceFile, List<String> preparedCommand, Path preparedOutputPath) {
        return pending(sourceFile, preparedCommand, preparedOutputPath, null);
    }

    /**
     * Creates a new pending job with a fresh id belonging to {@code group}.
     */
    public static Job pending(Path sourceFile, List<String> preparedCommand, Path preparedOutputPath,
                              JobGroup group) {
        Instant now = Instant.now();
        return new Job(UUID.randomUUID(), sourceFile, null, group, preparedCommand, preparedOutputPath,
                JobStatus.PENDING, null, null, 0, now, now, null, null);
    }

    /** Progress derived from status. */
    public double progress() {
        return status.progress();
    }

    public Job toRunning(Instant now) {
        return new Job(id, sourceFile, displayName, group, preparedCommand, preparedOutputPath,
                JobStatus.RUNNING, sidecarPath, null, attempts + 1, createdAt, now, now, null);
    }

    public Job toDone(Instant now) {
        return new Job(id, sourceFile, displayName, group, preparedCommand, preparedOutputPath,
                JobStatus.DONE, sidecarPath, null, attempts, createdAt, now, startedAt, now);
    }

    public Job toFailed(String reason, Instant now) {
        return new Job(id, sourceFile, displayName, group, preparedCommand, preparedOutputPath,
                JobStatus.FAILED, sidecarPath, reason, attempts, createdAt, now, startedAt, now);
    }

    public Job toCanceled(String reason, Instant now) {
        return new Job(id, sourceFile, displayName, group, preparedCommand, preparedOutputPath,
                JobStatus.CANCELED, sidecarPath, reason, attempts, createdAt, now, startedAt, now);
    }

    /**
     * Returns this job back in PENDING with error, timestamps and attempt counter cleared.
     */
    public Job toResumed(Instant now) {
        return new Job(id, sourceFile, displayName, group, preparedCommand, preparedOutputPath,
                JobStatus.PENDING, sidecarPath, null, 0, createdAt, now, null, null);
    }

    public Job withSidecarPath(Path path, Instant now) {
        return new Job(id, sourceFile, displayName, group, preparedCommand, preparedOutputPath,
                status, path, errorMessage, attempts, createdAt, now, startedAt, finishedAt);
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
