package com.phillippitts.batchanalyzer.exception;

/**
 * Thrown when the remaining cost budget cannot cover the next capability call.
 */
public class BudgetExceededException extends BatchAnalysisException {

    private final double requested;
    private final double remaining;

    public BudgetExceededException(double requested, double remaining) {
        super(String.format(java.util.Locale.ROOT,
                "Budget exhausted: requested %.4f, remaining %.4f", requested, remaining));
        this.requested = requested;
        this.remaining = remaining;
    }

    public double getRequested() {
        return requested;
    }

    public double getRemaining() {
        return remaining;
    }
}
