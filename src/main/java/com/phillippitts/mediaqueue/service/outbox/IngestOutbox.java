package com.phillippitts.mediaqueue.service.outbox;

import com.phillippitts.mediaqueue.config.properties.OutboxProperties;
import com.phillippitts.mediaqueue.config.properties.StorageProperties;
import com.phillippitts.mediaqueue.domain.OutboxEntry;
import com.phillippitts.mediaqueue.domain.OutboxSnapshot;
import com.phillippitts.mediaqueue.util.AtomicFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable, deduplicated set of files waiting to be handed to the {@link IngestSink}.
 *
 * <p>Entries are keyed by file path. A failed entry waits out the configured backoff before it
 * is eligible again and is abandoned in place once it reaches {@code maxAttempts}, so the last
 * error stays inspectable. Every mutation is mirrored to the outbox file when one is configured.
 *
 * <p>Thread-safe: all state is guarded by a single lock.
 */
@Component
public class IngestOutbox {

    private static final Logger LOG = LogManager.getLogger(IngestOutbox.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<OutboxEntry> entries = new ArrayList<>();
    private final Path file;
    private final OutboxProperties properties;
    private final Clock clock;

    @Autowired
    public IngestOutbox(StorageProperties storage, OutboxProperties properties, Clock clock) {
        this(storage.persistOutbox() ? storage.outboxFilePath() : null, properties, clock);
    }

    /**
     * @param file outbox file, or {@code null} to keep entries in memory only
     */
    public IngestOutbox(Path file, OutboxProperties properties, Clock clock) {
        this.file = file;
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        entries.addAll(readFile());
    }

    /**
     * Adds an entry for {@code filePath} unless one already exists.
     *
     * @return {@code true} if a new entry was created
     */
    public boolean enqueue(Path filePath, UUID jobId) {
        Path normalized = Objects.requireNonNull(filePath, "filePath").toAbsolutePath().normalize();
        lock.lock();
        try {
            boolean exists = entries.stream().anyMatch(e -> e.filePath().equals(normalized));
            if (exists) {
                LOG.debug("Outbox already holds {}", normalized);
                return false;
            }
            entries.add(OutboxEntry.create(normalized, jobId));
            writeFile();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Oldest entry that is below the attempt limit and past its backoff window.
     */
    public Optional<OutboxEntry> nextPending() {
        lock.lock();
        try {
            Instant now = clock.instant();
            return entries.stream()
                    .filter(e -> isEligible(e, now))
                    .findFirst();
        } finally {
            lock.unlock();
        }
    }

    /** Whether any entry is currently eligible for an attempt. */
    public boolean hasEligible() {
        return nextPending().isPresent();
    }

    public void markSuccess(UUID entryId) {
        lock.lock();
        try {
            if (entries.removeIf(e -> e.id().equals(entryId))) {
                writeFile();
            }
        } finally {
            lock.unlock();
        }
    }

    public void markFailure(UUID entryId, String error) {
        lock.lock();
        try {
            for (int i = 0; i < entries.size(); i++) {
                OutboxEntry entry = entries.get(i);
                if (!entry.id().equals(entryId)) {
                    continue;
                }
                OutboxEntry failed = entry.recordFailure(error, clock.instant());
                entries.set(i, failed);
                if (failed.isAbandoned(properties.maxAttempts())) {
                    LOG.error("Abandoning ingest of {} after {} attempts: {}",
                            failed.filePath(), failed.attempts(), error);
                } else {
                    LOG.warn("Ingest of {} failed (attempt {}/{}): {}",
                            failed.filePath(), failed.attempts(), properties.maxAttempts(), error);
                }
                writeFile();
                return;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Drops every entry, including abandoned ones. */
    public void reset() {
        lock.lock();
        try {
            entries.clear();
            writeFile();
        } finally {
            lock.unlock();
        }
    }

    public List<OutboxEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public OutboxSnapshot snapshot() {
        lock.lock();
        try {
            int errors = 0;
            int abandoned = 0;
            for (OutboxEntry entry : entries) {
                if (entry.lastError() != null) {
                    errors++;
                }
                if (entry.isAbandoned(properties.maxAttempts())) {
                    abandoned++;
                }
            }
            return new OutboxSnapshot(entries.size(), errors, abandoned);
        } finally {
            lock.unlock();
        }
    }

    private boolean isEligible(OutboxEntry entry, Instant now) {
        if (entry.isAbandoned(properties.maxAttempts())) {
            return false;
        }
        if (entry.lastFailureAt() == null) {
            return true;
        }
        Instant retryAt = entry.lastFailureAt().plus(properties.backoffAfter(entry.attempts()));
        return !now.isBefore(retryAt);
    }

    private void writeFile() {
        if (file == null) {
            return;
        }
        JSONArray array = new JSONArray();
        for (OutboxEntry entry : entries) {
            JSONObject json = new JSONObject();
            json.put("id", entry.id().toString());
            json.put("filePath", entry.filePath().toString());
            if (entry.jobId() != null) {
                json.put("jobId", entry.jobId().toString());
            }
            json.put("attempts", entry.attempts());
            if (entry.lastFailureAt() != null) {
                json.put("lastFailureAt", entry.lastFailureAt().toString());
            }
            if (entry.lastError() != null) {
                json.put("lastError", entry.lastError());
            }
            array.put(json);
        }
        try {
            AtomicFiles.writeString(file, array.toString(2));
        } catch (IOException e) {
            LOG.warn("Failed to save ingest outbox to {}: {}", file, e.toString());
        }
    }

    private List<OutboxEntry> readFile() {
        if (file == null || !Files.exists(file)) {
            return List.of();
        }
        try {
            JSONArray array = new JSONArray(Files.readString(file, StandardCharsets.UTF_8));
            List<OutboxEntry> loaded = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                JSONObject json = array.getJSONObject(i);
                String jobId = json.optString("jobId", null);
                String failedAt = json.optString("lastFailureAt", null);
                loaded.add(new OutboxEntry(
                        UUID.fromString(json.getString("id")),
                        jobId == null ? null : UUID.fromString(jobId),
                        Path.of(json.getString("filePath")).toAbsolutePath().normalize(),
                        json.optInt("attempts", 0),
                        failedAt == null ? null : Instant.parse(failedAt),
                        json.optString("lastError", null)));
            }
            LOG.debug("Restored {} outbox entries from {}", loaded.size(), file);
            return loaded;
        } catch (IOException e) {
            LOG.error("Failed to read ingest outbox {}: {}", file, e.toString());
            return List.of();
        } catch (JSONException | IllegalArgumentException | NullPointerException
                 | DateTimeParseException e) {
            LOG.error("Corrupt ingest outbox {}, starting empty: {}", file, e.toString());
            return List.of();
        }
    }
}
