/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mediaqueue.exception.MediaQueueException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.mediaqueue.exception.InvalidJobException} - Thrown when a job
 *       handed to the queue is not pending or duplicates a queued id</li>
 *   <li>{@link com.phillippitts.mediaqueue.exception.ArtifactCacheException} - Thrown when the
 *       remote artifact cache fails at the transport or HTTP level</li>
 * </ul>
 *
 * <p>Process failures have no exception type: the command runner reports them as
 * {@link com.phillippitts.mediaqueue.domain.RunResult} values. Persistence and sidecar file
 * errors are logged and absorbed where they occur.
 *
 * @see com.phillippitts.mediaqueue.exception.MediaQueueException
 * @since 1.0
 */
package com.phillippitts.mediaqueue.exception;
