/**
 * Logging infrastructure and ThreadContext (MDC) keys.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Admin API request identifier, set by
 *       {@link com.phillippitts.mediaqueue.config.logging.MdcFilter}</li>
 *   <li>{@code jobId} - Job being prepared, run or finished</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2024-05-01 10:15:30.529 INFO  [queue-engine-1] c.p.m.s.e.QueueEngine [jobId=... requestId=] - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.mediaqueue.config.logging;
