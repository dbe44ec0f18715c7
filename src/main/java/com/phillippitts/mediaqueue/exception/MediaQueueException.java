package com.phillippitts.mediaqueue.exception;

/**
 * Base exception for all media-queue application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MediaQueueException extends RuntimeException {

    public MediaQueueException(String message) {
        super(message);
    }

    public MediaQueueException(String message, Throwable cause) {
        super(message, cause);
    }

    public MediaQueueException(Throwable cause) {
        super(cause);
    }
}
