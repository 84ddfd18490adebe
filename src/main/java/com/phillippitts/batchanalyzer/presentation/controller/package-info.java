/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/batch/analyze} - run a batch over server-side image paths</li>
 *   <li>{@code POST /api/batch/estimate} - group and price a batch without analyzing it</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.batchanalyzer.presentation.controller;
