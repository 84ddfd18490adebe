package com.phillippitts.batchanalyzer.service.tier;

/**
 * One capability call made while selecting a tier.
 *
 * @param tier       tier name
 * @param outcome    what happened
 * @param detail     failure message or unmet thresholds; null when accepted
 * @param durationMs wall time of the call
 */
public record TierAttempt(String tier, Outcome outcome, String detail, long durationMs) {

    public enum Outcome { ACCEPTED, INSUFFICIENT, FAILED }
}
