/**
 * Domain model for the media queue.
 *
 * <p>Types here are immutable records and enums with no Spring or I/O dependencies:
 * <ul>
 *   <li>{@link com.phillippitts.mediaqueue.domain.Job} and
 *       {@link com.phillippitts.mediaqueue.domain.JobStatus} - queued work and its lifecycle</li>
 *   <li>{@link com.phillippitts.mediaqueue.domain.RunResult} - outcome of one command execution</li>
 *   <li>{@link com.phillippitts.mediaqueue.domain.OutboxEntry} - a pending ingestion hand-off</li>
 * </ul>
 */
package com.phillippitts.mediaqueue.domain;
