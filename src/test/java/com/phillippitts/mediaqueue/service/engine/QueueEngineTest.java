package com.phillippitts.mediaqueue.service.engine;

import com.phillippitts.mediaqueue.config.properties.OutboxProperties;
import com.phillippitts.mediaqueue.config.properties.StorageProperties;
import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.JobStatus;
import com.phillippitts.mediaqueue.domain.OutboxEntry;
import com.phillippitts.mediaqueue.domain.RunResult;
import com.phillippitts.mediaqueue.exception.InvalidJobException;
import com.phillippitts.mediaqueue.service.events.JobFinishedEvent;
import com.phillippitts.mediaqueue.service.outbox.IngestOutbox;
import com.phillippitts.mediaqueue.service.outbox.IngestPassListener;
import com.phillippitts.mediaqueue.service.outbox.IngestProcessor;
import com.phillippitts.mediaqueue.service.persistence.JsonQueuePersistence;
import com.phillippitts.mediaqueue.service.persistence.QueuePersistence;
import com.phillippitts.mediaqueue.service.sidecar.FileSystemSidecarResolver;
import com.phillippitts.mediaqueue.testutil.EventCapturingPublisher;
import com.phillippitts.mediaqueue.testutil.FakeCommandRunner;
import com.phillippitts.mediaqueue.testutil.InMemoryQueuePersistence;
import com.phillippitts.mediaqueue.testutil.MutableClock;
import com.phillippitts.mediaqueue.testutil.RecordingIngestSink;
import com.phillippitts.mediaqueue.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class QueueEngineTest {

    private static final RunResult SUCCESS = RunResult.exited(0, "ok", "");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FileSystemSidecarResolver resolver;
    private IngestOutbox outbox;
    private RecordingIngestSink sink;
    private IngestProcessor processor;
    private EventCapturingPublisher publisher;
    private QueuePersistence persistence;
    private ExecutorService engineThread;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:15:30Z");
        resolver = new FileSystemSidecarResolver(StorageProperties.under(tempDir), clock);
        outbox = new IngestOutbox((Path) null, OutboxProperties.defaults(), clock);
        sink = RecordingIngestSink.accepting();
        processor = new IngestProcessor(outbox, sink, new SyncExecutor(), IngestPassListener.NO_OP);
        publisher = new EventCapturingPublisher();
        persistence = new InMemoryQueuePersistence();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (engineThread != null) {
            engineThread.shutdownNow();
            engineThread.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private QueueEngine syncEngine(FakeCommandRunner runner) {
        return new QueueEngine(runner, resolver, persistence, outbox, processor, new SyncExecutor(), clock, publisher);
    }

    private QueueEngine threadedEngine(FakeCommandRunner runner) {
        engineThread = Executors.newSingleThreadExecutor();
        return new QueueEngine(runner, resolver, persistence, outbox, processor, engineThread, clock, publisher);
    }

    private Job job(String name) {
        return Job.pending(tempDir.resolve(name), List.of("analyze", "--audio", name), null);
    }

    private List<JobStatus> statuses(QueueEngine engine) {
        return engine.jobs().stream().map(Job::status).toList();
    }

    @Test
    void enqueueDoesNotStartExecution() {
        // Arrange
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);

        // Act
        engine.enqueue(List.of(job("a.wav"), job("b.wav")));

        // Assert
        assertThat(statuses(engine)).containsExactly(JobStatus.PENDING, JobStatus.PENDING);
        assertThat(runner.runCount()).isZero();
        assertThat(persistence.load()).hasSize(2);
    }

    @Test
    void shouldRunJobsInEnqueueOrderOneAtATime() {
        // Arrange
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job a = job("a.wav");
        Job b = job("b.wav");
        Job c = job("c.wav");
        engine.enqueue(List.of(a, b, c));

        // Act + Assert
        engine.start();
        assertThat(runner.runCount()).isEqualTo(1);
        assertThat(statuses(engine)).containsExactly(JobStatus.RUNNING, JobStatus.PENDING, JobStatus.PENDING);
        assertThat(engine.isRunning()).isTrue();

        runner.complete(0, SUCCESS);
        assertThat(statuses(engine)).containsExactly(JobStatus.DONE, JobStatus.RUNNING, JobStatus.PENDING);

        runner.complete(1, SUCCESS);
        runner.complete(2, SUCCESS);

        assertThat(statuses(engine)).containsOnly(JobStatus.DONE);
        assertThat(runner.invocations()).extracting(inv -> inv.job().id())
                .containsExactly(a.id(), b.id(), c.id());
        assertThat(sink.files()).containsExactly(a.sourceFile(), b.sourceFile(), c.sourceFile());
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    void finishedJobIsInOutboxBeforeNextJobIsPersistedAsRunning() {
        // Arrange
        InMemoryQueuePersistence recording = new InMemoryQueuePersistence();
        persistence = recording;
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job a = job("a.wav");
        Job b = job("b.wav");
        AtomicReference<List<Path>> outboxWhenBStarted = new AtomicReference<>();
        recording.onSave(jobs -> {
            boolean bRunning = jobs.stream()
                    .anyMatch(j -> j.id().equals(b.id()) && j.status() == JobStatus.RUNNING);
            if (bRunning) {
                outboxWhenBStarted.compareAndSet(null,
                        outbox.entries().stream().map(OutboxEntry::filePath).toList());
            }
        });
        engine.enqueue(List.of(a, b));
        engine.start();

        // Act
        runner.complete(0, SUCCESS);

        // Assert
        assertThat(outboxWhenBStarted.get()).containsExactly(a.sourceFile());
    }

    @Test
    void startWhileRunningIsNoOp() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        engine.enqueue(List.of(job("a.wav"), job("b.wav")));

        engine.start();
        engine.start();

        assertThat(runner.runCount()).isEqualTo(1);
    }

    @Test
    void startWithNothingPendingIsNoOp() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);

        engine.start();

        assertThat(runner.runCount()).isZero();
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    void shouldMarkFailedWithoutIngestingAndContinue() {
        // Arrange
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job first = job("first.wav");
        Job second = job("second.wav");
        engine.enqueue(List.of(first, second));

        // Act
        engine.start();
        runner.complete(0, RunResult.exited(1, "", "  boom: bad input \n"));
        runner.complete(1, SUCCESS);

        // Assert
        assertThat(statuses(engine)).containsExactly(JobStatus.FAILED, JobStatus.DONE);
        assertThat(engine.job(first.id())).get().extracting(Job::errorMessage).isEqualTo("boom: bad input");
        assertThat(sink.calls()).hasSize(1);
        assertThat(sink.files()).containsExactly(second.sourceFile());
    }

    @Test
    void failureWithoutStderrReportsExitCode() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job only = job("a.wav");
        engine.enqueue(List.of(only));

        engine.start();
        runner.complete(0, RunResult.exited(3, "", ""));

        assertThat(engine.job(only.id())).get().extracting(Job::errorMessage).isEqualTo("exit 3");
    }

    @Test
    void spawnFailureFailsJobWithSpawnReason() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job only = job("a.wav");
        engine.enqueue(List.of(only));

        engine.start();
        runner.complete(0, RunResult.spawnFailure("Cannot run program \"analyze\""));

        Job result = engine.job(only.id()).orElseThrow();
        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(result.errorMessage()).contains("Cannot run program");
        assertThat(sink.calls()).isEmpty();
    }

    @Test
    void exceptionalRunnerFutureFailsJob() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job only = job("a.wav");
        engine.enqueue(List.of(only));

        engine.start();
        runner.invocations().get(0).future().completeExceptionally(new IllegalStateException("runner broke"));

        Job result = engine.job(only.id()).orElseThrow();
        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(result.errorMessage()).contains("runner broke");
    }

    @Test
    void stopCancelsRunningAndPendingAndDiscardsLateResult() {
        // Arrange
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        engine.enqueue(List.of(job("a.wav"), job("b.wav"), job("c.wav")));
        engine.start();

        // Act
        engine.stop();
        runner.complete(0, SUCCESS);

        // Assert
        assertThat(statuses(engine)).containsOnly(JobStatus.CANCELED);
        assertThat(engine.jobs()).extracting(Job::errorMessage).containsOnly(QueueEngine.CANCELED_REASON);
        assertThat(runner.cancelCount()).isEqualTo(1);
        assertThat(runner.runCount()).isEqualTo(1);
        assertThat(sink.calls()).isEmpty();
        assertThat(outbox.entries()).isEmpty();
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    void shouldCompleteAllJobsAfterResumeAndStart() {
        // Arrange
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        engine.enqueue(List.of(job("a.wav"), job("b.wav"), job("c.wav")));
        engine.start();
        engine.stop();

        // Act
        int resumed = engine.resumeCanceled();
        assertThat(statuses(engine)).containsOnly(JobStatus.PENDING);
        assertThat(engine.jobs()).extracting(Job::attempts).containsOnly(0);
        engine.start();
        for (int i = 1; i <= 3; i++) {
            runner.complete(i, SUCCESS);
        }

        // Assert
        assertThat(resumed).isEqualTo(3);
        assertThat(statuses(engine)).containsOnly(JobStatus.DONE);
        assertThat(sink.calls()).hasSize(3);
    }

    @Test
    void resumeDoesNotStartExecution() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        engine.enqueue(List.of(job("a.wav")));
        engine.start();
        engine.stop();

        engine.resumeCanceled();

        assertThat(runner.runCount()).isEqualTo(1);
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    void lateResultFromCanceledRunDoesNotAffectResumedRun() {
        // Arrange
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job a = job("a.wav");
        Job b = job("b.wav");
        engine.enqueue(List.of(a, b));
        engine.start();
        engine.stop();
        engine.resumeCanceled();
        engine.start();

        // Act: the first (canceled) process finally exits
        runner.complete(0, RunResult.exited(1, "", "killed"));

        // Assert: resumed run of the same job is untouched
        assertThat(engine.job(a.id())).get().extracting(Job::status).isEqualTo(JobStatus.RUNNING);
        assertThat(runner.runCount()).isEqualTo(2);

        runner.complete(1, SUCCESS);
        assertThat(engine.job(a.id())).get().extracting(Job::status).isEqualTo(JobStatus.DONE);
        assertThat(runner.runCount()).isEqualTo(3);
    }

    @Test
    void attemptsCountEveryStart() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job a = job("a.wav");
        engine.enqueue(List.of(a));

        engine.start();

        assertThat(engine.job(a.id())).get().extracting(Job::attempts).isEqualTo(1);
    }

    @Test
    void startAssignsSidecarPath() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Path out = tempDir.resolve("out/a_features.json");
        Job prepared = Job.pending(tempDir.resolve("a.wav"), List.of("analyze"), out);
        engine.enqueue(List.of(prepared));

        engine.start();

        assertThat(engine.job(prepared.id())).get().extracting(Job::sidecarPath).isEqualTo(out);
        assertThat(persistence.load().get(0).sidecarPath()).isEqualTo(out);
    }

    @Test
    void doneJobIsNeverRunOrIngestedAgain() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        engine.enqueue(List.of(job("a.wav")));
        engine.start();
        runner.complete(0, SUCCESS);

        engine.resumeCanceled();
        engine.start();

        assertThat(runner.runCount()).isEqualTo(1);
        assertThat(sink.calls()).hasSize(1);
    }

    @Test
    void clearOperationsNeverRemoveRunningJob() {
        // Arrange
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job a = job("a.wav");
        Job b = job("b.wav");
        Job c = job("c.wav");
        engine.enqueue(List.of(a, b, c));
        engine.start();
        runner.complete(0, SUCCESS);

        // Act
        boolean removedRunning = engine.remove(b.id());
        int cleared = engine.clearAll();

        // Assert
        assertThat(removedRunning).isFalse();
        assertThat(cleared).isEqualTo(2);
        assertThat(engine.jobs()).extracting(Job::id).containsExactly(b.id());
        assertThat(persistence.load()).extracting(Job::id).containsExactly(b.id());
    }

    @Test
    void clearCompletedAndClearCanceledFailedRemoveByStatus() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job done = job("done.wav");
        Job failed = job("failed.wav");
        Job canceled = job("canceled.wav");
        engine.enqueue(List.of(done, failed, canceled));
        engine.start();
        runner.complete(0, SUCCESS);
        runner.complete(1, RunResult.exited(2, "", "bad"));
        engine.stop();

        assertThat(engine.clearCompleted()).isEqualTo(1);
        assertThat(engine.jobs()).extracting(Job::id).containsExactly(failed.id(), canceled.id());

        assertThat(engine.clearCanceledFailed()).isEqualTo(2);
        assertThat(engine.jobs()).isEmpty();
    }

    @Test
    void removeDeletesNonRunningJob() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        Job a = job("a.wav");
        engine.enqueue(List.of(a));

        assertThat(engine.remove(a.id())).isTrue();
        assertThat(engine.remove(UUID.randomUUID())).isFalse();
        assertThat(engine.jobs()).isEmpty();
    }

    @Test
    void resetAllClearsJobsAndOutbox() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        sink.answer(path -> false);
        QueueEngine engine = syncEngine(runner);
        engine.enqueue(List.of(job("a.wav")));
        engine.start();
        runner.complete(0, SUCCESS);
        assertThat(engine.ingestPendingCount()).isEqualTo(1);
        assertThat(engine.ingestErrorCount()).isEqualTo(1);

        engine.resetAll();

        assertThat(engine.jobs()).isEmpty();
        assertThat(engine.ingestPendingCount()).isZero();
    }

    @Test
    void enqueueRejectsNonPendingJobWithoutAppending() {
        QueueEngine engine = syncEngine(FakeCommandRunner.manual());
        Job good = job("a.wav");
        Job done = job("b.wav").toRunning(clock.instant()).toDone(clock.instant());

        assertThatThrownBy(() -> engine.enqueue(List.of(good, done)))
                .isInstanceOf(InvalidJobException.class)
                .hasMessageContaining(done.id().toString());
        assertThat(engine.jobs()).isEmpty();
    }

    @Test
    void enqueueRejectsDuplicateId() {
        QueueEngine engine = syncEngine(FakeCommandRunner.manual());
        Job a = job("a.wav");
        engine.enqueue(List.of(a));

        assertThatThrownBy(() -> engine.enqueue(List.of(a)))
                .isInstanceOf(InvalidJobException.class)
                .hasMessageContaining("duplicate id");
        assertThat(engine.jobs()).hasSize(1);
    }

    @Test
    void restartRestoresJobsAndFailsInterruptedRun() {
        // Arrange: previous session crashed while a job was running
        persistence = new JsonQueuePersistence(tempDir.resolve("queue.json"), clock);
        Job done = job("done.wav").toRunning(clock.instant()).toDone(clock.instant());
        Job running = job("running.wav").toRunning(clock.instant());
        Job pending = job("pending.wav");
        persistence.save(List.of(done, running, pending));

        // Act
        QueueEngine engine = syncEngine(FakeCommandRunner.manual());

        // Assert
        assertThat(statuses(engine)).containsExactly(JobStatus.DONE, JobStatus.FAILED, JobStatus.PENDING);
        assertThat(engine.job(running.id())).get().extracting(Job::errorMessage)
                .isEqualTo(QueuePersistence.INTERRUPTED_REASON);
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    void restartDrainsLeftoverOutboxEntries() {
        // Arrange
        Path outboxFile = tempDir.resolve("ingest_outbox.json");
        Path leftover = tempDir.resolve("leftover.wav");
        new IngestOutbox(outboxFile, OutboxProperties.defaults(), clock).enqueue(leftover, UUID.randomUUID());
        outbox = new IngestOutbox(outboxFile, OutboxProperties.defaults(), clock);
        processor = new IngestProcessor(outbox, sink, new SyncExecutor(), IngestPassListener.NO_OP);

        // Act
        syncEngine(FakeCommandRunner.manual());

        // Assert
        assertThat(sink.files()).containsExactly(leftover);
        assertThat(outbox.entries()).isEmpty();
    }

    @Test
    void shouldPublishFinishedEvents() {
        FakeCommandRunner runner = FakeCommandRunner.manual();
        QueueEngine engine = syncEngine(runner);
        engine.enqueue(List.of(job("a.wav"), job("b.wav"), job("c.wav")));
        engine.start();

        clock.advance(Duration.ofSeconds(4));
        runner.complete(0, RunResult.exited(1, "", "bad"));
        runner.complete(1, SUCCESS);
        engine.stop();

        assertThat(publisher.jobFinishedEvents()).extracting(JobFinishedEvent::status)
                .containsExactly(JobStatus.FAILED, JobStatus.DONE, JobStatus.CANCELED);
        assertThat(publisher.jobFinishedEvents().get(0).duration()).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void shouldFinishFiveHundredJobsWithOneIngestEach() {
        // Arrange
        FakeCommandRunner runner = FakeCommandRunner.alwaysSucceeding();
        QueueEngine engine = threadedEngine(runner);
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            jobs.add(job("track-" + i + ".wav"));
        }
        engine.enqueue(jobs);

        // Act
        engine.start();

        // Assert
        await().atMost(Duration.ofSeconds(30))
                .until(() -> engine.summary().done() == 500);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> sink.calls().size() == 500);
        assertThat(runner.invocations()).extracting(inv -> inv.job().id())
                .containsExactlyElementsOf(jobs.stream().map(Job::id).toList());
        assertThat(sink.files()).doesNotHaveDuplicates();
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    void failThenSucceedOnEngineThread() {
        Job first = job("first.wav");
        Job second = job("second.wav");
        FakeCommandRunner runner = FakeCommandRunner.answering(j -> j.id().equals(first.id())
                ? RunResult.exited(1, "", "nope")
                : SUCCESS);
        QueueEngine engine = threadedEngine(runner);
        engine.enqueue(List.of(first, second));

        engine.start();

        await().atMost(Duration.ofSeconds(10))
                .until(() -> engine.summary().running() == 0 && engine.summary().pending() == 0);
        assertThat(statuses(engine)).containsExactly(JobStatus.FAILED, JobStatus.DONE);
        assertThat(sink.files()).containsExactly(second.sourceFile());
    }
}
