package com.phillippitts.batchanalyzer.service.tier;

import com.phillippitts.batchanalyzer.domain.Tier;
import com.phillippitts.batchanalyzer.exception.BudgetExceededException;
import com.phillippitts.batchanalyzer.exception.CapabilityException;

/**
 * Admission control wrapped around every capability call.
 *
 * <p>{@link #beforeCall(Tier)} may block (call spacing) and may refuse the call (budget).
 * Exactly one of {@link #afterSuccess} or {@link #afterFailure} follows every admitted call.
 */
public interface CallGate {

    /**
     * Waits until the call may be issued and reserves its estimated cost.
     *
     * @return the reserved amount, handed back in the completion callback
     * @throws BudgetExceededException if the remaining budget cannot cover the tier
     * @throws CapabilityException     if the wait was interrupted
     */
    double beforeCall(Tier tier);

    void afterSuccess(Tier tier, double reserved, double actualCost);

    void afterFailure(Tier tier, double reserved);

    /**
     * Gate that admits every call immediately.
     */
    static CallGate open() {
        return new CallGate() {
            @Override
            public double beforeCall(Tier tier) {
                return 0.0;
            }

            @Override
            public void afterSuccess(Tier tier, double reserved, double actualCost) {
                // nothing to track
            }

            @Override
            public void afterFailure(Tier tier, double reserved) {
                // nothing to track
            }
        };
    }
}
