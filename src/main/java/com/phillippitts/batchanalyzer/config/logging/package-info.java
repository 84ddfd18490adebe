/**
 * Logging infrastructure: request correlation via Log4j2 ThreadContext.
 */
package com.phillippitts.batchanalyzer.config.logging;
