package com.phillippitts.batchanalyzer.service.batch;

import com.phillippitts.batchanalyzer.exception.BudgetExceededException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks spend against an optional cost ceiling.
 *
 * <p>Before each call the tier's estimated cost is reserved; the reservation is replaced by the
 * actual cost on success or released on failure. A call is refused when the remaining budget,
 * net of outstanding reservations, is zero or below the estimate. As long as estimates are
 * upper bounds of actual costs, spend never exceeds the ceiling.
 */
final class BudgetGuard {

    private static final Logger LOG = LogManager.getLogger(BudgetGuard.class);
    private static final double WARNING_UTILIZATION = 0.8;

    private final Double ceiling;
    private double spent;
    private double reserved;
    private boolean warned;

    /**
     * @param ceiling      maximum total cost, or null for unlimited
     * @param alreadySpent cost carried over from a resumed run
     */
    BudgetGuard(Double ceiling, double alreadySpent) {
        if (ceiling != null && (ceiling < 0.0 || ceiling.isNaN())) {
            throw new IllegalArgumentException("ceiling must be >= 0, got: " + ceiling);
        }
        this.ceiling = ceiling;
        this.spent = alreadySpent;
    }

    /**
     * @return the reserved amount
     * @throws BudgetExceededException if the estimate does not fit in the remaining budget
     */
    synchronized double reserve(double estimate) {
        if (ceiling != null) {
            double remaining = ceiling - spent - reserved;
            if (remaining <= 0.0 || remaining < estimate) {
                throw new BudgetExceededException(estimate, Math.max(0.0, remaining));
            }
        }
        reserved += estimate;
        return estimate;
    }

    synchronized void commit(double reservation, double actualCost) {
        reserved = Math.max(0.0, reserved - reservation);
        spent += actualCost;
        if (ceiling != null && !warned && ceiling > 0.0 && spent >= ceiling * WARNING_UTILIZATION) {
            warned = true;
            LOG.warn("Budget {}% used ({} of {})", Math.round(spent / ceiling * 100), spent, ceiling);
        }
    }

    synchronized void release(double reservation) {
        reserved = Math.max(0.0, reserved - reservation);
    }

    synchronized double spent() {
        return spent;
    }

    /**
     * Remaining budget net of reservations; positive infinity when unlimited.
     */
    synchronized double remaining() {
        return ceiling == null ? Double.POSITIVE_INFINITY : ceiling - spent - reserved;
    }
}
