package com.phillippitts.batchanalyzer.service.batch;

/**
 * Up-front cost estimate for a batch, priced at a single tier.
 *
 * @param itemCount     items in the batch
 * @param groupCount    groups after similarity grouping (capability calls needed)
 * @param tier          tier used for pricing
 * @param costPerCall   estimated cost of one call at that tier
 * @param naiveCost     cost of analyzing every item individually
 * @param optimizedCost cost of analyzing one representative per group
 */
public record CostEstimate(
        int itemCount,
        int groupCount,
        String tier,
        double costPerCall,
        double naiveCost,
        double optimizedCost
) {

    public double estimatedSavings() {
        return naiveCost - optimizedCost;
    }

    public int callsAvoided() {
        return itemCount - groupCount;
    }
}
