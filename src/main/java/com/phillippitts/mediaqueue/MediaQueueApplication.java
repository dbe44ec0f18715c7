package com.phillippitts.mediaqueue;

import com.phillippitts.mediaqueue.config.properties.ArtifactCacheProperties;
import com.phillippitts.mediaqueue.config.properties.JobsProperties;
import com.phillippitts.mediaqueue.config.properties.OutboxProperties;
import com.phillippitts.mediaqueue.config.properties.RunnerProperties;
import com.phillippitts.mediaqueue.config.properties.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        StorageProperties.class,
        RunnerProperties.class,
        OutboxProperties.class,
        JobsProperties.class,
        ArtifactCacheProperties.class
})
@EnableScheduling
public class MediaQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaQueueApplication.class, args);
    }

}
