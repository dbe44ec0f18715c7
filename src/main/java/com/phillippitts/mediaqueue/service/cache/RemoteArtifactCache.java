package com.phillippitts.mediaqueue.service.cache;

import com.phillippitts.mediaqueue.config.properties.ArtifactCacheProperties;
import com.phillippitts.mediaqueue.exception.ArtifactCacheException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Objects;

/**
 * Client for the content-addressed artifact cache.
 *
 * <p>Layout on the cache:
 * <pre>
 * GET /echo/{configHash}/{sourceHash}/{artifactName}   artifact, honours If-None-Match
 * GET /echo/{configHash}/{sourceHash}/{manifestName}   manifest
 * GET /echo/index/{trackId}.json                       latest pointer for a track
 * </pre>
 * A 304 answer is a success ({@link ArtifactFetch.Outcome#NOT_MODIFIED}); any other non-200
 * status raises {@link ArtifactCacheException}.
 */
public class RemoteArtifactCache {

    private static final Logger LOG = LogManager.getLogger(RemoteArtifactCache.class);

    private final RestTemplate restTemplate;
    private final ArtifactCacheProperties properties;

    public RemoteArtifactCache(RestTemplate restTemplate, ArtifactCacheProperties properties) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Downloads the artifact for a configuration and source pair.
     *
     * @param etag validator from a previous fetch, or {@code null} for an unconditional request
     * @throws ArtifactCacheException on transport errors or an unexpected status
     */
    public ArtifactFetch fetchArtifact(String configHash, String sourceHash, String etag) {
        URI uri = uri("echo", configHash, sourceHash, properties.artifactName());
        HttpHeaders headers = new HttpHeaders();
        if (etag != null && !etag.isBlank()) {
            headers.set(HttpHeaders.IF_NONE_MATCH, etag);
        }
        ResponseEntity<byte[]> response = exchange(uri, headers, byte[].class);
        int status = response.getStatusCode().value();
        if (status == HttpStatus.NOT_MODIFIED.value()) {
            LOG.debug("Artifact {}/{} not modified", configHash, sourceHash);
            return ArtifactFetch.notModified(etag);
        }
        if (status != HttpStatus.OK.value()) {
            throw new ArtifactCacheException("Unexpected artifact response from " + uri, status);
        }
        return ArtifactFetch.fetched(response.getBody(), response.getHeaders().getFirst(HttpHeaders.ETAG));
    }

    /**
     * Downloads the manifest for a configuration and source pair as raw JSON text.
     */
    public String fetchManifest(String configHash, String sourceHash) {
        URI uri = uri("echo", configHash, sourceHash, properties.manifestName());
        return requireOk(uri, exchange(uri, new HttpHeaders(), String.class));
    }

    /**
     * Reads the latest index pointer published for {@code trackId}.
     *
     * @throws ArtifactCacheException if the pointer is missing, unreachable or malformed
     */
    public IndexPointer fetchLatest(String trackId) {
        URI uri = uri("echo", "index", trackId + ".json");
        String body = requireOk(uri, exchange(uri, new HttpHeaders(), String.class));
        try {
            return IndexPointer.fromJson(new JSONObject(body));
        } catch (JSONException e) {
            throw new ArtifactCacheException("Malformed index pointer for track " + trackId, e);
        }
    }

    private <T> ResponseEntity<T> exchange(URI uri, HttpHeaders headers, Class<T> type) {
        try {
            return restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), type);
        } catch (HttpStatusCodeException e) {
            throw new ArtifactCacheException("Artifact cache request failed for " + uri,
                    e.getStatusCode().value());
        } catch (RestClientException e) {
            throw new ArtifactCacheException("Artifact cache unreachable at " + uri, e);
        }
    }

    private static String requireOk(URI uri, ResponseEntity<String> response) {
        int status = response.getStatusCode().value();
        if (status != HttpStatus.OK.value() || response.getBody() == null) {
            throw new ArtifactCacheException("Unexpected response from " + uri, status);
        }
        return response.getBody();
    }

    private URI uri(String... segments) {
        return UriComponentsBuilder.fromHttpUrl(properties.baseUrl())
                .pathSegment(segments)
                .build()
                .encode()
                .toUri();
    }
}
