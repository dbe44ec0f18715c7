/**
 * Presentation layer: the local admin REST API and its exception handling.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - {@code /queue} endpoints</li>
 *   <li>{@code presentation.exception} - Domain exception to HTTP status mapping</li>
 * </ul>
 *
 * <p>Controllers are thin adapters over {@link com.phillippitts.mediaqueue.service.engine.QueueEngine}.
 *
 * @since 1.0
 */
package com.phillippitts.mediaqueue.presentation;
