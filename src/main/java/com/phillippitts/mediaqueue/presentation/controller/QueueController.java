package com.phillippitts.mediaqueue.presentation.controller;

import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.OutboxSnapshot;
import com.phillippitts.mediaqueue.domain.QueueSummary;
import com.phillippitts.mediaqueue.service.engine.QueueEngine;
import com.phillippitts.mediaqueue.service.jobs.JobFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Local admin API for the job queue.
 *
 * <pre>
 * GET    /queue/jobs                      list jobs in queue order
 * POST   /queue/jobs   {"paths": [...]}   enqueue dropped files/folders
 * DELETE /queue/jobs?scope=completed|canceled-failed|all
 * DELETE /queue/jobs/{id}
 * POST   /queue/start | /queue/stop | /queue/resume | /queue/reset
 * GET    /queue/summary
 * </pre>
 */
@RestController
@RequestMapping("/queue")
class QueueController {

    private static final Logger LOG = LogManager.getLogger(QueueController.class);

    private final QueueEngine engine;
    private final JobFactory jobFactory;

    QueueController(QueueEngine engine, JobFactory jobFactory) {
        this.engine = engine;
        this.jobFactory = jobFactory;
    }

    record EnqueueRequest(List<String> paths) {}

    @GetMapping("/jobs")
    List<JobView> jobs() {
        return engine.jobs().stream().map(JobView::of).toList();
    }

    @PostMapping("/jobs")
    ResponseEntity<Map<String, Object>> enqueue(@RequestBody EnqueueRequest request) {
        if (request == null || request.paths() == null || request.paths().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "paths must not be empty"));
        }
        List<Job> jobs = jobFactory.fromPaths(request.paths().stream().map(Path::of).toList());
        engine.enqueue(jobs);
        LOG.info("Enqueued {} job(s) via API", jobs.size());
        return ResponseEntity.accepted().body(Map.of("enqueued", jobs.size()));
    }

    @DeleteMapping("/jobs")
    ResponseEntity<Map<String, Object>> clear(@RequestParam(defaultValue = "completed") String scope) {
        int removed = switch (scope) {
            case "completed" -> engine.clearCompleted();
            case "canceled-failed" -> engine.clearCanceledFailed();
            case "all" -> engine.clearAll();
            default -> -1;
        };
        if (removed < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "unknown scope: " + scope));
        }
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    @DeleteMapping("/jobs/{id}")
    ResponseEntity<Void> remove(@PathVariable UUID id) {
        return engine.remove(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PostMapping("/start")
    ResponseEntity<QueueSummary> start() {
        engine.start();
        return ResponseEntity.ok(engine.summary());
    }

    @PostMapping("/stop")
    ResponseEntity<QueueSummary> stop() {
        engine.stop();
        return ResponseEntity.ok(engine.summary());
    }

    @PostMapping("/resume")
    ResponseEntity<Map<String, Object>> resume() {
        return ResponseEntity.ok(Map.of("resumed", engine.resumeCanceled()));
    }

    @PostMapping("/reset")
    ResponseEntity<Void> reset() {
        engine.resetAll();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/summary")
    Map<String, Object> summary() {
        QueueSummary summary = engine.summary();
        OutboxSnapshot outbox = engine.ingestSnapshot();
        return Map.of(
                "jobs", summary,
                "running", engine.isRunning(),
                "ingestPending", outbox.pending(),
                "ingestErrors", outbox.errors());
    }
}
