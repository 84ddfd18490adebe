/**
 * Immutable domain model: items, fingerprints, similarity groups, tiers and analysis results.
 *
 * <p>All types are records validated in their compact constructors. Collections are copied
 * on construction so instances can be shared across worker threads.
 *
 * @since 1.0
 */
package com.phillippitts.batchanalyzer.domain;
