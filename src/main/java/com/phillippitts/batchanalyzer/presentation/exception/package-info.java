/**
 * Maps exceptions escaping controllers to {@code ApiError} responses.
 */
package com.phillippitts.batchanalyzer.presentation.exception;
