/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.batchanalyzer.config.ThreadPoolConfig} - analysis and capability
 *       executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.batchanalyzer.config.ThreadPoolMetricsConfig} - pool gauges</li>
 *   <li>{@link com.phillippitts.batchanalyzer.config.AnalysisEngineConfig} - hashing, grouping, tier
 *       selection and checkpoint storage beans</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code batch.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.batchanalyzer.config;
