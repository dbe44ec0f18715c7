package com.phillippitts.mediaqueue.service.sidecar;

import com.phillippitts.mediaqueue.config.properties.StorageProperties;
import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.SidecarPaths;
import com.phillippitts.mediaqueue.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Local-disk {@link SidecarResolver}.
 *
 * <p>Jobs without a prepared output path get one synthesized under the application's sidecar
 * directory: {@code <sidecarDir>/<source stem>_<timestamp>.json}.
 */
@Component
public class FileSystemSidecarResolver implements SidecarResolver {

    private static final Logger LOG = LogManager.getLogger(FileSystemSidecarResolver.class);

    private final Path sidecarDir;
    private final Clock clock;

    @Autowired
    public FileSystemSidecarResolver(StorageProperties storage, Clock clock) {
        this(storage.sidecarDir(), clock);
    }

    FileSystemSidecarResolver(Path sidecarDir, Clock clock) {
        this.sidecarDir = Objects.requireNonNull(sidecarDir, "sidecarDir");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public SidecarPaths ensureSidecar(Job job) {
        Path finalPath = job.preparedOutputPath() != null
                ? job.preparedOutputPath()
                : defaultSidecar(job.sourceFile());
        ensureParent(finalPath);
        Path tempPath = finalPath.resolveSibling(finalPath.getFileName() + ".tmp-" + UUID.randomUUID());
        return new SidecarPaths(finalPath, tempPath);
    }

    @Override
    public void cleanupTemp(Path tempPath) {
        if (tempPath == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(tempPath)) {
                LOG.debug("Removed temp sidecar {}", tempPath);
            }
        } catch (IOException e) {
            LOG.debug("Could not remove temp sidecar {}: {}", tempPath, e.toString());
        }
    }

    @Override
    public void finalizeSidecar(Path tempPath, Path finalPath) {
        if (finalPath == null) {
            return;
        }
        ensureParent(finalPath);
        if (Files.exists(finalPath)) {
            // First writer wins
            cleanupTemp(tempPath);
            return;
        }
        if (tempPath == null || !Files.exists(tempPath)) {
            return;
        }
        try {
            moveIntoPlace(tempPath, finalPath);
            LOG.debug("Finalized sidecar {}", finalPath);
        } catch (FileAlreadyExistsException e) {
            cleanupTemp(tempPath);
        } catch (IOException e) {
            LOG.debug("Could not finalize sidecar {} -> {}: {}", tempPath, finalPath, e.toString());
        }
    }

    private static void moveIntoPlace(Path tempPath, Path finalPath) throws IOException {
        try {
            Files.move(tempPath, finalPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempPath, finalPath);
        }
    }

    private Path defaultSidecar(Path sourceFile) {
        String fileName = sourceFile.getFileName() == null ? "job" : sourceFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return sidecarDir.resolve(stem + "_" + TimeUtils.fileStamp(clock.instant()) + ".json");
    }

    private static void ensureParent(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            LOG.debug("Could not create sidecar directory {}: {}", parent, e.toString());
        }
    }
}
