/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters over
 * {@link com.phillippitts.batchanalyzer.service.batch.BatchCoordinator}; the exception handler
 * maps run-level exceptions to HTTP status codes.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers and request bodies</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.batchanalyzer.presentation;
