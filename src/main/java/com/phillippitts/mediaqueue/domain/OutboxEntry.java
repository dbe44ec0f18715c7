package com.phillippitts.mediaqueue.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One pending hand-off of a finished artifact to ingestion.
 *
 * @param id            entry identifier
 * @param jobId         job that produced the artifact, or {@code null}
 * @param filePath      file to ingest; unique across the outbox
 * @param attempts      failed ingestion attempts so far
 * @param lastFailureAt time of the most recent failure, or {@code null}
 * @param lastError     most recent failure reason, or {@code null}
 */
public record OutboxEntry(
        UUID id,
        UUID jobId,
        Path filePath,
        int attempts,
        Instant lastFailureAt,
        String lastError
) {

    public OutboxEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(filePath, "filePath");
    }

    public static OutboxEntry create(Path filePath, UUID jobId) {
        return new OutboxEntry(UUID.randomUUID(), jobId, filePath, 0, null, null);
    }

    public OutboxEntry recordFailure(String error, Instant at) {
        return new OutboxEntry(id, jobId, filePath, attempts + 1, at, error);
    }

    /** Entries at the attempt limit stay in the outbox for inspection but are never retried. */
    public boolean isAbandoned(int maxAttempts) {
        return attempts >= maxAttempts;
    }
}
