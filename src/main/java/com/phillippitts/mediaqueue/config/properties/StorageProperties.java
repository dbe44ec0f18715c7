package com.phillippitts.mediaqueue.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Locations of the queue's durable state.
 *
 * <p>Example application.properties:
 * <pre>
 * queue.storage.app-dir=${user.home}/.media-queue
 * queue.storage.queue-file=queue.json
 * queue.storage.outbox-file=ingest_outbox.json
 * queue.storage.sidecar-dir-name=sidecars
 * queue.storage.persist-outbox=true
 * </pre>
 *
 * @param appDir         application-owned directory holding snapshots and default sidecars
 * @param queueFile      job snapshot file name, relative to {@code appDir}
 * @param outboxFile     outbox file name, relative to {@code appDir}
 * @param sidecarDirName directory under {@code appDir} for synthesized output paths
 * @param persistOutbox  whether the outbox is mirrored to disk
 */
@ConfigurationProperties(prefix = "queue.storage")
@Validated
public record StorageProperties(
        @NotBlank(message = "Application directory must not be blank")
        String appDir,

        @NotBlank @DefaultValue("queue.json")
        String queueFile,

        @NotBlank @DefaultValue("ingest_outbox.json")
        String outboxFile,

        @NotBlank @DefaultValue("sidecars")
        String sidecarDirName,

        @DefaultValue("true")
        boolean persistOutbox
) {

    /**
     * Storage rooted at {@code appDir} with default file names.
     */
    public static StorageProperties under(Path appDir) {
        return new StorageProperties(appDir.toString(), "queue.json", "ingest_outbox.json", "sidecars", true);
    }

    public Path appDirPath() {
        return Path.of(appDir);
    }

    public Path queueFilePath() {
        return appDirPath().resolve(queueFile);
    }

    public Path outboxFilePath() {
        return appDirPath().resolve(outboxFile);
    }

    public Path sidecarDir() {
        return appDirPath().resolve(sidecarDirName);
    }
}
