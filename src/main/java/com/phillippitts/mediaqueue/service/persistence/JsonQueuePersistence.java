package com.phillippitts.mediaqueue.service.persistence;

import com.phillippitts.mediaqueue.config.properties.StorageProperties;
import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.JobGroup;
import com.phillippitts.mediaqueue.domain.JobStatus;
import com.phillippitts.mediaqueue.domain.QueueSummary;
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
import java.util.UUID;

/**
 * Stores the job set as a JSON array in a single file.
 *
 * <p>Record layout:
 * <pre>
 * {"id": "...", "filePath": "/music/a.wav", "displayName": "a.wav", "status": "done",
 *  "groupId": "...", "groupName": "set", "groupRootPath": "/music",
 *  "preparedCommand": ["analyze", "--audio", "/music/a.wav"], "preparedOutPath": "...",
 *  "sidecarPath": "...", "errorMessage": null, "attempts": 1,
 *  "createdAt": "2024-05-01T10:15:30Z", "updatedAt": "...", "startedAt": "...", "finishedAt": "..."}
 * </pre>
 * Optional fields are omitted when null. Writes go through a temp file and an atomic move.
 */
@Component
public class JsonQueuePersistence implements QueuePersistence {

    private static final Logger LOG = LogManager.getLogger(JsonQueuePersistence.class);

    private final Path file;
    private final Clock clock;

    @Autowired
    public JsonQueuePersistence(StorageProperties storage, Clock clock) {
        this(storage.queueFilePath(), clock);
    }

    public JsonQueuePersistence(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void save(List<Job> jobs) {
        JSONArray array = new JSONArray();
        for (Job job : jobs) {
            array.put(toJson(job));
        }
        try {
            AtomicFiles.writeString(file, array.toString(2));
            if (LOG.isDebugEnabled()) {
                LOG.debug("Saved {} jobs to {} ({})", jobs.size(), file, QueueSummary.of(jobs));
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to save queue snapshot to {}: {}", file, e.toString());
        }
    }

    @Override
    public List<Job> load() {
        if (!Files.exists(file)) {
            LOG.debug("No queue snapshot at {}", file);
            return List.of();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Failed to read queue snapshot {}: {}", file, e.toString());
            return List.of();
        }
        try {
            JSONArray array = new JSONArray(content);
            Instant now = clock.instant();
            List<Job> jobs = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                Job job = fromJson(array.getJSONObject(i));
                if (job.status() == JobStatus.RUNNING) {
                    job = job.toFailed(INTERRUPTED_REASON, now);
                }
                jobs.add(job);
            }
            LOG.debug("Loaded {} jobs from {} ({})", jobs.size(), file, QueueSummary.of(jobs));
            return List.copyOf(jobs);
        } catch (JSONException | IllegalArgumentException | NullPointerException
                 | DateTimeParseException e) {
            // Fail closed: a partial set could resurrect or drop work inconsistently
            LOG.error("Corrupt queue snapshot {}, starting empty: {}", file, e.toString());
            return List.of();
        }
    }

    static JSONObject toJson(Job job) {
        JSONObject json = new JSONObject();
        json.put("id", job.id().toString());
        json.put("filePath", job.sourceFile().toString());
        json.put("displayName", job.displayName());
        json.put("status", job.status().wireName());
        if (job.group() != null) {
            json.put("groupId", job.group().id().toString());
            putIfPresent(json, "groupName", job.group().name());
            putIfPresent(json, "groupRootPath", job.group().rootPath());
        }
        json.put("preparedCommand", new JSONArray(job.preparedCommand()));
        putIfPresent(json, "preparedOutPath", job.preparedOutputPath());
        putIfPresent(json, "sidecarPath", job.sidecarPath());
        putIfPresent(json, "errorMessage", job.errorMessage());
        json.put("attempts", job.attempts());
        json.put("createdAt", job.createdAt().toString());
        putIfPresent(json, "updatedAt", job.updatedAt());
        putIfPresent(json, "startedAt", job.startedAt());
        putIfPresent(json, "finishedAt", job.finishedAt());
        return json;
    }

    static Job fromJson(JSONObject json) {
        JobGroup group = null;
        String groupId = json.optString("groupId", null);
        if (groupId != null) {
            group = new JobGroup(UUID.fromString(groupId), json.optString("groupName", null),
                    optPath(json, "groupRootPath"));
        }
        JSONArray commandArray = json.optJSONArray("preparedCommand");
        List<String> command = new ArrayList<>();
        if (commandArray != null) {
            for (int i = 0; i < commandArray.length(); i++) {
                command.add(commandArray.getString(i));
            }
        }
        return new Job(
                UUID.fromString(json.getString("id")),
                Path.of(json.getString("filePath")),
                json.optString("displayName", null),
                group,
                command,
                optPath(json, "preparedOutPath"),
                JobStatus.fromWireName(json.getString("status")),
                optPath(json, "sidecarPath"),
                json.optString("errorMessage", null),
                json.optInt("attempts", 0),
                Instant.parse(json.getString("createdAt")),
                optInstant(json, "updatedAt"),
                optInstant(json, "startedAt"),
                optInstant(json, "finishedAt"));
    }

    private static void putIfPresent(JSONObject json, String key, Object value) {
        if (value != null) {
            json.put(key, value.toString());
        }
    }

    private static Path optPath(JSONObject json, String key) {
        String value = json.optString(key, null);
        return value == null ? null : Path.of(value);
    }

    private static Instant optInstant(JSONObject json, String key) {
        String value = json.optString(key, null);
        return value == null ? null : Instant.parse(value);
    }
}
