package com.phillippitts.mediaqueue.presentation.controller;

import com.phillippitts.mediaqueue.domain.Job;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * JSON shape of a job for the admin API.
 */
record JobView(
        String id,
        String sourceFile,
        String displayName,
        String group,
        String status,
        double progress,
        String sidecarPath,
        String errorMessage,
        int attempts,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {

    static JobView of(Job job) {
        return new JobView(
                job.id().toString(),
                job.sourceFile().toString(),
                job.displayName(),
                job.group() == null ? null : job.group().name(),
                job.status().wireName(),
                job.progress(),
                pathOrNull(job.sidecarPath()),
                job.errorMessage(),
                job.attempts(),
                job.createdAt(),
                job.startedAt(),
                job.finishedAt());
    }

    private static String pathOrNull(Path path) {
        return Objects.toString(path, null);
    }
}
