package com.phillippitts.mediaqueue.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Client settings for the optional content-addressed artifact cache.
 *
 * @param enabled        whether the client bean is created
 * @param baseUrl        broker root, e.g. {@code http://localhost:8099}
 * @param timeoutSeconds connect and read timeout
 * @param artifactName   artifact file name under {@code echo/<config>/<source>/}
 * @param manifestName   manifest file name under the same prefix
 */
@ConfigurationProperties(prefix = "queue.cache")
@Validated
public record ArtifactCacheProperties(
        @DefaultValue("false")
        boolean enabled,

        @DefaultValue("http://localhost:8099")
        String baseUrl,

        @Positive @DefaultValue("15")
        int timeoutSeconds,

        @NotBlank @DefaultValue("historical_echo.json")
        String artifactName,

        @NotBlank @DefaultValue("manifest.json")
        String manifestName
) {}
