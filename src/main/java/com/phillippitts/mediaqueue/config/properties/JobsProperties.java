package com.phillippitts.mediaqueue.config.properties;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * How dropped files become jobs.
 *
 * <p>Example:
 * <pre>
 * queue.jobs.base-command=tools/analyze --profile default --out /data/out/features.json
 * queue.jobs.audio-extensions=wav,mp3,flac
 * </pre>
 *
 * @param baseCommand     analysis command line, shell-style quoting allowed
 * @param audioExtensions lowercase extensions accepted as job sources
 */
@ConfigurationProperties(prefix = "queue.jobs")
@Validated
public record JobsProperties(
        @DefaultValue("")
        String baseCommand,

        @NotEmpty @DefaultValue({"wav", "mp3", "m4a", "aif", "aiff", "flac", "ogg", "oga", "opus", "caf"})
        List<String> audioExtensions
) {

    public static final List<String> DEFAULT_AUDIO_EXTENSIONS =
            List.of("wav", "mp3", "m4a", "aif", "aiff", "flac", "ogg", "oga", "opus", "caf");

    public static JobsProperties withCommand(String baseCommand) {
        return new JobsProperties(baseCommand, DEFAULT_AUDIO_EXTENSIONS);
    }
}
