package com.phillippitts.mediaqueue.service.outbox;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Downstream consumer of finished artifacts.
 *
 * <p>Implementations must tolerate repeated calls for the same path: the outbox retries an
 * entry until it succeeds or is abandoned.
 */
@FunctionalInterface
public interface IngestSink {

    /**
     * @param file  file to ingest
     * @param jobId job that produced it, or {@code null}
     * @return {@code true} if the file was ingested (or already had been)
     */
    boolean ingest(Path file, UUID jobId);
}
