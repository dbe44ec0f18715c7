/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.mediaqueue.config.ThreadPoolConfig} - Runner, ingest and engine
 *       executors</li>
 *   <li>{@link com.phillippitts.mediaqueue.config.QueueConfig} - Clock, default ingest sink and the
 *       optional artifact cache client</li>
 *   <li>{@link com.phillippitts.mediaqueue.config.QueueMetricsConfig} - Queue and outbox gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code queue.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - Request MDC filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.mediaqueue.config;
