package com.phillippitts.batchanalyzer.exception;

import java.util.List;

/**
 * Thrown when a batch run is configured with invalid parameters.
 *
 * <p>This is the only error that fails a whole run, and it is always raised before
 * any capability call is issued.
 */
public class BatchConfigurationException extends BatchAnalysisException {

    private final List<String> violations;

    public BatchConfigurationException(String violation) {
        this(List.of(violation));
    }

    public BatchConfigurationException(List<String> violations) {
        super("Invalid batch configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
