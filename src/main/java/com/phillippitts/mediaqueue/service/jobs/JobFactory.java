package com.phillippitts.mediaqueue.service.jobs;

import com.phillippitts.mediaqueue.config.properties.JobsProperties;
import com.phillippitts.mediaqueue.config.properties.StorageProperties;
import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.domain.JobGroup;
import com.phillippitts.mediaqueue.exception.MediaQueueException;
import com.phillippitts.mediaqueue.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns dropped files and folders into pending jobs with fully prepared commands.
 *
 * <p>Command preparation:
 * <ul>
 *   <li>an executable ending in {@code automator.sh} gets the audio path appended positionally and
 *       no prepared output path</li>
 *   <li>otherwise {@code --audio <path>} and {@code --out <path>} are replaced in place or
 *       appended; the output path is {@code <sidecarDir>/<stem>_<timestamp>.<ext>}</li>
 * </ul>
 * Stem and extension come from the base command's own {@code --out} value when present,
 * otherwise from the audio file name and {@code json}.
 */
@Component
public class JobFactory {

    private static final Logger LOG = LogManager.getLogger(JobFactory.class);

    static final String AUDIO_FLAG = "--audio";
    static final String OUT_FLAG = "--out";
    static final String AUTOMATOR_SUFFIX = "automator.sh";

    private final List<String> baseCommand;
    private final Set<String> audioExtensions;
    private final Path sidecarDir;
    private final Clock clock;

    @Autowired
    public JobFactory(JobsProperties jobs, StorageProperties storage, Clock clock) {
        this(jobs, storage.sidecarDir(), clock);
    }

    public JobFactory(JobsProperties jobs, Path sidecarDir, Clock clock) {
        this.baseCommand = CommandLineSplitter.split(jobs.baseCommand());
        this.audioExtensions = new HashSet<>();
        jobs.audioExtensions().forEach(ext -> audioExtensions.add(ext.toLowerCase(Locale.ROOT)));
        this.sidecarDir = Objects.requireNonNull(sidecarDir, "sidecarDir");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Builds jobs for every audio file among {@code paths}. Folders are walked recursively and
     * each becomes one group; non-audio files are skipped.
     *
     * @throws MediaQueueException if no base command is configured or a folder cannot be read
     */
    public List<Job> fromPaths(List<Path> paths) {
        if (baseCommand.isEmpty()) {
            throw new MediaQueueException("No analysis command configured (queue.jobs.base-command)");
        }
        List<Job> jobs = new ArrayList<>();
        Set<Path> plannedOutputs = new HashSet<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                JobGroup group = JobGroup.forFolder(path);
                for (Path file : audioFilesUnder(path)) {
                    jobs.add(build(file, group, plannedOutputs));
                }
            } else if (isAudio(path)) {
                jobs.add(build(path, null, plannedOutputs));
            } else {
                LOG.debug("Skipping non-audio file {}", path);
            }
        }
        LOG.info("Prepared {} job(s) from {} dropped path(s)", jobs.size(), paths.size());
        return jobs;
    }

    /**
     * Builds a single ungrouped job for {@code audioFile} regardless of its extension.
     */
    public Job fromFile(Path audioFile) {
        if (baseCommand.isEmpty()) {
            throw new MediaQueueException("No analysis command configured (queue.jobs.base-command)");
        }
        return build(audioFile, null, new HashSet<>());
    }

    boolean isAudio(Path file) {
        if (!Files.isRegularFile(file)) {
            return false;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && audioExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private List<Path> audioFilesUnder(Path folder) {
        try (Stream<Path> walk = Files.walk(folder)) {
            return walk.filter(this::isAudio).sorted().toList();
        } catch (IOException e) {
            throw new MediaQueueException("Failed to scan folder " + folder, e);
        }
    }

    private Job build(Path audioFile, JobGroup group, Set<Path> plannedOutputs) {
        Path audio = audioFile.toAbsolutePath();
        List<String> command = new ArrayList<>(baseCommand);
        if (command.get(0).endsWith(AUTOMATOR_SUFFIX)) {
            command.add(audio.toString());
            return Job.pending(audio, command, null, group);
        }
        Path out = outputPathFor(audio, plannedOutputs);
        setFlag(command, AUDIO_FLAG, audio.toString());
        setFlag(command, OUT_FLAG, out.toString());
        return Job.pending(audio, command, out, group);
    }

    private Path outputPathFor(Path audio, Set<Path> plannedOutputs) {
        String stem = stemOf(audio.getFileName().toString());
        String ext = "json";
        int outIndex = baseCommand.indexOf(OUT_FLAG);
        if (outIndex >= 0 && outIndex + 1 < baseCommand.size()) {
            Path configured = Path.of(baseCommand.get(outIndex + 1)).getFileName();
            if (configured != null) {
                String name = configured.toString();
                int dot = name.lastIndexOf('.');
                stem = dot > 0 ? name.substring(0, dot) : name;
                ext = dot > 0 ? name.substring(dot + 1) : ext;
            }
        }
        String base = stem + "_" + TimeUtils.fileStamp(clock.instant());
        Path out = sidecarDir.resolve(base + "." + ext);
        // Same stem twice in one batch would otherwise collide within the same second
        for (int n = 2; !plannedOutputs.add(out); n++) {
            out = sidecarDir.resolve(base + "-" + n + "." + ext);
        }
        return out;
    }

    private static void setFlag(List<String> command, String flag, String value) {
        int index = command.indexOf(flag);
        if (index < 0) {
            command.add(flag);
            command.add(value);
        } else if (index + 1 < command.size()) {
            command.set(index + 1, value);
        } else {
            command.add(value);
        }
    }

    private static String stemOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
