package com.phillippitts.mediaqueue.service.cache;

/**
 * Result of a conditional artifact download.
 *
 * @param outcome whether new bytes arrived
 * @param body    artifact bytes; empty when not modified
 * @param etag    validator to send next time (the response's, or the caller's when not modified)
 */
public record ArtifactFetch(Outcome outcome, byte[] body, String etag) {

    public enum Outcome {
        FETCHED,
        NOT_MODIFIED
    }

    public ArtifactFetch {
        body = body == null ? new byte[0] : body;
    }

    public static ArtifactFetch fetched(byte[] body, String etag) {
        return new ArtifactFetch(Outcome.FETCHED, body, etag);
    }

    public static ArtifactFetch notModified(String etag) {
        return new ArtifactFetch(Outcome.NOT_MODIFIED, null, etag);
    }

    public boolean isModified() {
        return outcome == Outcome.FETCHED;
    }
}
