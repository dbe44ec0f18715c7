package com.phillippitts.mediaqueue.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Final and temporary output locations for one job run.
 *
 * @param finalPath where the finished artifact lives
 * @param tempPath  sibling file the run writes to before {@code finalize}
 */
public record SidecarPaths(Path finalPath, Path tempPath) {

    public SidecarPaths {
        Objects.requireNonNull(finalPath, "finalPath");
        Objects.requireNonNull(tempPath, "tempPath");
    }
}
