package com.phillippitts.batchanalyzer.service.batch;

import com.phillippitts.batchanalyzer.service.progress.RunState;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one batch run. Contains one outcome per submitted item, in submission order.
 *
 * @param runToken                checkpoint key of the run
 * @param state                   COMPLETED, or ABORTED when stopped early
 * @param outcomes                per-item outcomes in input order
 * @param groupCount              groups formed from the items not processed earlier
 * @param capabilityCalls         capability calls issued in this run, escalations included
 * @param callsAvoided            items whose result was derived instead of analyzed
 * @param runCost                 cost incurred in this run
 * @param cumulativeCost          cost across this run and resumed predecessors
 * @param estimatedSavings        estimated cost avoided by deriving results
 * @param duration                wall time of the run
 * @param resumabilityCompromised true when a checkpoint could not be written
 */
public record BatchReport(
        String runToken,
        RunState state,
        List<ItemOutcome> outcomes,
        int groupCount,
        int capabilityCalls,
        int callsAvoided,
        double runCost,
        double cumulativeCost,
        double estimatedSavings,
        Duration duration,
        boolean resumabilityCompromised
) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public int totalItems() {
        return outcomes.size();
    }

    public int count(OutcomeStatus status) {
        return (int) outcomes.stream().filter(o -> o.status() == status).count();
    }

    public Optional<ItemOutcome> outcomeFor(String itemId) {
        return outcomes.stream().filter(o -> o.itemId().equals(itemId)).findFirst();
    }

    /**
     * Share of items skipped, in percent.
     */
    public double skippedPercentage() {
        return outcomes.isEmpty() ? 0.0 : 100.0 * count(OutcomeStatus.SKIPPED) / outcomes.size();
    }
}
