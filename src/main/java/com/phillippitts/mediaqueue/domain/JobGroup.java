package com.phillippitts.mediaqueue.domain;

import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * Folder grouping for jobs produced from one dropped directory.
 *
 * <p>Display-only metadata: the engine never branches on it, but it survives persistence.
 *
 * @param id       group identifier shared by every job from the same folder
 * @param name     folder display name (may be null)
 * @param rootPath folder the jobs were discovered under (may be null)
 */
public record JobGroup(UUID id, String name, Path rootPath) {

    public JobGroup {
        Objects.requireNonNull(id, "Group id must not be null");
    }

    public static JobGroup forFolder(Path folder) {
        Path name = folder.getFileName();
        return new JobGroup(UUID.randomUUID(), name == null ? folder.toString() : name.toString(), folder);
    }
}
