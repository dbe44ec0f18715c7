package com.phillippitts.mediaqueue.presentation.exception;

import com.phillippitts.mediaqueue.exception.ArtifactCacheException;
import com.phillippitts.mediaqueue.exception.InvalidJobException;
import com.phillippitts.mediaqueue.exception.MediaQueueException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the admin API.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - job rejected by the queue (HTTP 400).
     */
    @ExceptionHandler(InvalidJobException.class)
    ResponseEntity<ApiError> handleInvalidJob(InvalidJobException ex) {
        LOG.warn("Rejected job {}: {}", ex.getJobId(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getClass().getSimpleName(), "Invalid job", ex.getMessage(), Instant.now()));
    }

    /**
     * Upstream cache failure (HTTP 502).
     */
    @ExceptionHandler(ArtifactCacheException.class)
    ResponseEntity<ApiError> handleCache(ArtifactCacheException ex) {
        LOG.warn("Artifact cache error: status={}", ex.getHttpStatus(), ex);
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(ex.getClass().getSimpleName(), "Artifact cache unavailable",
                    ex.getMessage(), Instant.now()));
    }

    /**
     * Queue could not act on the request, e.g. no command configured (HTTP 422).
     */
    @ExceptionHandler(MediaQueueException.class)
    ResponseEntity<ApiError> handleQueue(MediaQueueException ex) {
        LOG.warn("Queue request failed: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(ex.getClass().getSimpleName(), "Request could not be processed",
                    ex.getMessage(), Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError("InternalServerError", "An unexpected error occurred",
                    "See server log for the request ID", Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
