package com.phillippitts.mediaqueue.exception;

/**
 * Thrown when the remote artifact cache cannot be reached or answers with an unexpected status.
 * A "not modified" answer is not an error and never raises this exception.
 */
public class ArtifactCacheException extends MediaQueueException {

    private final int httpStatus;

    public ArtifactCacheException(String message, int httpStatus) {
        super(message + " (status: " + httpStatus + ")");
        this.httpStatus = httpStatus;
    }

    public ArtifactCacheException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = -1;
    }

    /**
     * @return HTTP status of the failed call, or -1 when no response was received
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
