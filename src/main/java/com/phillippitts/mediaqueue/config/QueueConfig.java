package com.phillippitts.mediaqueue.config;

import com.phillippitts.mediaqueue.config.properties.ArtifactCacheProperties;
import com.phillippitts.mediaqueue.config.properties.StorageProperties;
import com.phillippitts.mediaqueue.service.cache.RemoteArtifactCache;
import com.phillippitts.mediaqueue.service.outbox.IngestSink;
import com.phillippitts.mediaqueue.service.outbox.ManifestIngestSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators the queue components share: the clock, the default ingest sink and the optional
 * artifact cache client.
 */
@Configuration
public class QueueConfig {

    private static final Logger LOG = LogManager.getLogger(QueueConfig.class);

    static final String INGEST_MANIFEST = "ingested.jsonl";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(IngestSink.class)
    public IngestSink ingestSink(StorageProperties storage, Clock clock) {
        LOG.info("Using ingest manifest {}", storage.appDirPath().resolve(INGEST_MANIFEST));
        return new ManifestIngestSink(storage.appDirPath().resolve(INGEST_MANIFEST), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "queue.cache", name = "enabled", havingValue = "true")
    public RemoteArtifactCache remoteArtifactCache(RestTemplateBuilder builder, ArtifactCacheProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.timeoutSeconds());
        return new RemoteArtifactCache(builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build(), properties);
    }
}
