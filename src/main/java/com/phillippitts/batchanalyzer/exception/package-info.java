/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.batchanalyzer.exception.BatchAnalysisException}:
 * <ul>
 *   <li>{@link com.phillippitts.batchanalyzer.exception.BatchConfigurationException} - invalid run
 *       parameters; the only error that fails a whole run</li>
 *   <li>{@link com.phillippitts.batchanalyzer.exception.CapabilityException} - a single vision
 *       capability call failed (rate limit, timeout, auth, transient, fatal)</li>
 *   <li>{@link com.phillippitts.batchanalyzer.exception.TierExhaustedException} - every tier failed
 *       for one representative</li>
 *   <li>{@link com.phillippitts.batchanalyzer.exception.BudgetExceededException} - the cost ceiling
 *       cannot cover the next call</li>
 *   <li>{@link com.phillippitts.batchanalyzer.exception.CheckpointException} - checkpoint I/O failed</li>
 *   <li>{@link com.phillippitts.batchanalyzer.exception.FingerprintMismatchException} - incomparable
 *       fingerprints</li>
 * </ul>
 *
 * <p>Item-level failures are recorded in the batch report rather than propagated; the REST layer
 * maps the rest via {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.batchanalyzer.exception;
