package com.phillippitts.mediaqueue.service.outbox;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Default sink: appends one JSON line per ingested file to a manifest that a library importer
 * consumes. Paths already listed are acknowledged without writing a second line. Unreadable
 * lines, such as one torn by a crash mid-append, are skipped with a warning.
 *
 * <pre>
 * {"file": "/music/a.wav", "jobId": "...", "ingestedAt": "2024-05-01T10:15:30Z"}
 * </pre>
 */
public class ManifestIngestSink implements IngestSink {

    private static final Logger LOG = LogManager.getLogger(ManifestIngestSink.class);

    private final Path manifest;
    private final Clock clock;
    private final Set<String> recorded = new HashSet<>();
    private boolean loaded;
    private boolean endsMidLine;

    public ManifestIngestSink(Path manifest, Clock clock) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized boolean ingest(Path file, UUID jobId) {
        if (!Files.isRegularFile(file)) {
            LOG.warn("Cannot ingest {}: file missing", file);
            return false;
        }
        try {
            loadOnce();
            String key = file.toAbsolutePath().toString();
            if (recorded.contains(key)) {
                return true;
            }
            JSONObject line = new JSONObject();
            line.put("file", key);
            if (jobId != null) {
                line.put("jobId", jobId.toString());
            }
            line.put("ingestedAt", clock.instant().toString());
            Path parent = manifest.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String entry = (endsMidLine ? System.lineSeparator() : "") + line + System.lineSeparator();
            Files.writeString(manifest, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            endsMidLine = false;
            recorded.add(key);
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to append {} to ingest manifest {}: {}", file, manifest, e.toString());
            return false;
        }
    }

    private void loadOnce() throws IOException {
        if (loaded) {
            return;
        }
        if (Files.exists(manifest)) {
            // Lenient decode: a torn append may end inside a multi-byte character
            String content = new String(Files.readAllBytes(manifest), StandardCharsets.UTF_8);
            int lineNumber = 0;
            for (String line : content.split("\\R")) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    recorded.add(new JSONObject(line).optString("file"));
                } catch (JSONException e) {
                    LOG.warn("Skipping unreadable line {} of ingest manifest {}: {}",
                            lineNumber, manifest, e.getMessage());
                }
            }
            endsMidLine = !content.isEmpty() && !content.endsWith("\n");
        }
        loaded = true;
    }
}
