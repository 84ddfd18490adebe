/**
 * Batch analysis services.
 *
 * <ul>
 *   <li>{@code service.hash} - perceptual fingerprints and similarity</li>
 *   <li>{@code service.grouping} - greedy near-duplicate grouping</li>
 *   <li>{@code service.capability} - vision capability contract</li>
 *   <li>{@code service.tier} - cost-escalating tier selection</li>
 *   <li>{@code service.propagation} - copying results to similar items</li>
 *   <li>{@code service.progress} - run ledger and checkpoints</li>
 *   <li>{@code service.batch} - the batch coordinator</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.health} - observability</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.batchanalyzer.service;
