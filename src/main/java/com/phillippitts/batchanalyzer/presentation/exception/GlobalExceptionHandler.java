package com.phillippitts.batchanalyzer.presentation.exception;

import com.phillippitts.batchanalyzer.exception.BatchAnalysisException;
import com.phillippitts.batchanalyzer.exception.BatchConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.nio.file.InvalidPathException;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Item-level failures never reach this class; they are part of the batch report.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid run parameters (HTTP 400).
     */
    @ExceptionHandler(BatchConfigurationException.class)
    ResponseEntity<ApiError> handleInvalidConfiguration(BatchConfigurationException ex) {
        LOG.warn("Rejected batch request: {}", ex.getViolations());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid batch configuration",
                String.join("; ", ex.getViolations()),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining("; "));
        LOG.warn("Invalid request body: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationFailed", "Invalid request", details, Instant.now()));
    }

    /**
     * Client error - unreadable body or malformed path (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, InvalidPathException.class})
    ResponseEntity<ApiError> handleMalformed(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("MalformedRequest", "Malformed request", ex.getMessage(), Instant.now()));
    }

    /**
     * Service-side error outside a single item, e.g. checkpoint storage (HTTP 503).
     */
    @ExceptionHandler(BatchAnalysisException.class)
    ResponseEntity<ApiError> handleAnalysisFailure(BatchAnalysisException ex) {
        LOG.error("Batch analysis failed", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Batch analysis temporarily unavailable",
                "Please retry; completed work is checkpointed",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
