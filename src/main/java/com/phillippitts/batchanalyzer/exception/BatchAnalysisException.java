package com.phillippitts.batchanalyzer.exception;

/**
 * Base exception for all batch-analyzer application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class BatchAnalysisException extends RuntimeException {

    public BatchAnalysisException(String message) {
        super(message);
    }

    public BatchAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public BatchAnalysisException(Throwable cause) {
        super(cause);
    }
}
