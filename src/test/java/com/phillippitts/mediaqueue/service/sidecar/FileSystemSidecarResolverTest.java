package com.phillippitts.mediaqueue.service.sidecar;

import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.SidecarPaths;
import com.phillippitts.mediaqueue.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class FileSystemSidecarResolverTest {

    @TempDir
    Path tempDir;

    private FileSystemSidecarResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new FileSystemSidecarResolver(tempDir.resolve("sidecars"), MutableClock.at("2024-05-01T10:15:30Z"));
    }

    @Test
    void shouldUsePreparedOutputPathAndCreateParent() {
        Path out = tempDir.resolve("nested/out/song_features.json");
        Job job = Job.pending(tempDir.resolve("song.wav"), List.of("analyze"), out);

        SidecarPaths paths = resolver.ensureSidecar(job);

        assertThat(paths.finalPath()).isEqualTo(out);
        assertThat(paths.tempPath().getParent()).isEqualTo(out.getParent());
        assertThat(paths.tempPath().getFileName().toString()).startsWith("song_features.json.tmp-");
        assertThat(out.getParent()).isDirectory();
    }

    @Test
    void shouldSynthesizeTimestampedPathWhenNoneWasPrepared() {
        Job job = Job.pending(tempDir.resolve("My Song.flac"), List.of("automator.sh"), null);

        SidecarPaths paths = resolver.ensureSidecar(job);

        assertThat(paths.finalPath()).isEqualTo(tempDir.resolve("sidecars/My Song_2024-05-01T10-15-30Z.json"));
        assertThat(tempDir.resolve("sidecars")).isDirectory();
    }

    @Test
    void tempPathsAreUniquePerCall() {
        Job job = Job.pending(tempDir.resolve("a.wav"), List.of("analyze"), tempDir.resolve("a.json"));

        assertThat(resolver.ensureSidecar(job).tempPath()).isNotEqualTo(resolver.ensureSidecar(job).tempPath());
    }

    @Test
    void finalizeMovesTempIntoPlace() throws Exception {
        Path temp = tempDir.resolve("a.json.tmp-1");
        Path target = tempDir.resolve("a.json");
        Files.writeString(temp, "{\"bpm\": 120}");

        resolver.finalizeSidecar(temp, target);

        assertThat(target).hasContent("{\"bpm\": 120}");
        assertThat(temp).doesNotExist();
    }

    @Test
    void finalizeKeepsExistingFinalAndDiscardsTemp() throws Exception {
        Path temp = tempDir.resolve("a.json.tmp-1");
        Path target = tempDir.resolve("a.json");
        Files.writeString(temp, "second");
        Files.writeString(target, "first");

        resolver.finalizeSidecar(temp, target);

        assertThat(target).hasContent("first");
        assertThat(temp).doesNotExist();
    }

    @Test
    void finalizeIsIdempotentAndToleratesMissingTemp() throws Exception {
        Path temp = tempDir.resolve("a.json.tmp-1");
        Path target = tempDir.resolve("a.json");
        Files.writeString(temp, "data");

        resolver.finalizeSidecar(temp, target);
        assertThatCode(() -> resolver.finalizeSidecar(temp, target)).doesNotThrowAnyException();
        assertThatCode(() -> resolver.finalizeSidecar(tempDir.resolve("never.tmp"), tempDir.resolve("never.json")))
                .doesNotThrowAnyException();

        assertThat(target).hasContent("data");
        assertThat(tempDir.resolve("never.json")).doesNotExist();
    }

    @Test
    void cleanupTempRemovesFileAndIgnoresMissing() throws Exception {
        Path temp = tempDir.resolve("a.json.tmp-1");
        Files.writeString(temp, "partial");

        resolver.cleanupTemp(temp);
        resolver.cleanupTemp(temp);
        resolver.cleanupTemp(null);

        assertThat(temp).doesNotExist();
    }
}
