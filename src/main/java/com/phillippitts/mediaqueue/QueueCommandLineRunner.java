package com.phillippitts.mediaqueue;

import com.phillippitts.mediaqueue.domain.Job;
import com.phillippitts.mediaqueue.service.engine.QueueEngine;
import com.phillippitts.mediaqueue.service.jobs.JobFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Enqueues files and folders given as non-option arguments, then starts the queue when
 * {@code queue.autostart} is set.
 *
 * <pre>
 * java -jar media-queue.jar ~/Music/set1 ~/Music/single.wav
 * </pre>
 */
@Component
class QueueCommandLineRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(QueueCommandLineRunner.class);

    private final QueueEngine engine;
    private final JobFactory jobFactory;
    private final boolean autostart;

    QueueCommandLineRunner(QueueEngine engine,
                           JobFactory jobFactory,
                           @Value("${queue.autostart:true}") boolean autostart) {
        this.engine = engine;
        this.jobFactory = jobFactory;
        this.autostart = autostart;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<Path> paths = args.getNonOptionArgs().stream().map(Path::of).toList();
        if (!paths.isEmpty()) {
            List<Job> jobs = jobFactory.fromPaths(paths);
            engine.enqueue(jobs);
        }
        if (autostart && engine.summary().pending() > 0) {
            LOG.info("Autostart enabled, starting queue");
            engine.start();
        }
    }
}
