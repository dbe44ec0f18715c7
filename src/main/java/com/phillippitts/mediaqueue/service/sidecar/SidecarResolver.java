package com.phillippitts.mediaqueue.service.sidecar;

import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.SidecarPaths;

import java.nio.file.Path;

/**
 * Places a job's output artifact.
 *
 * <p>Every method absorbs file system errors: a stray temp file costs disk space, never
 * correctness, because {@link #finalizeSidecar(Path, Path)} re-checks existence before trusting
 * a temp file.
 */
public interface SidecarResolver {

    /**
     * Resolves the final output path for {@code job} plus a sibling temp path, and makes sure the
     * containing directory exists.
     */
    SidecarPaths ensureSidecar(Job job);

    /**
     * Removes {@code tempPath} if present. Called on every failure and cancellation path.
     */
    void cleanupTemp(Path tempPath);

    /**
     * Promotes {@code tempPath} to {@code finalPath}. If {@code finalPath} already exists the temp
     * file is discarded (first writer wins); otherwise it is moved into place atomically.
     * Idempotent and safe to repeat after a crash.
     */
    void finalizeSidecar(Path tempPath, Path finalPath);
}
