/**
 * Service layer: the queue engine and its collaborators.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.engine} - Single-runner job queue state machine</li>
 *   <li>{@code service.runner} - Child process execution with capture, timeout and cancellation</li>
 *   <li>{@code service.sidecar} - Temp and final output placement</li>
 *   <li>{@code service.persistence} - Job snapshot file</li>
 *   <li>{@code service.outbox} - Durable ingestion hand-off and its drain loop</li>
 *   <li>{@code service.jobs} - Building jobs from dropped files and folders</li>
 *   <li>{@code service.cache} - Client for the remote content-addressed artifact cache</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.events} - Observability</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services use constructor injection and have a plain constructor for tests</li>
 *   <li>Process and file failures are reported as values or logged, not thrown</li>
 *   <li>Only {@link com.phillippitts.mediaqueue.service.engine.QueueEngine} changes job state</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.mediaqueue.service;
