package com.phillippitts.batchanalyzer.config.properties;

import com.phillippitts.batchanalyzer.domain.Tier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Escalation tiers (cheapest first) and the sufficiency thresholds that decide escalation.
 */
@ConfigurationProperties(prefix = "batch.tiers")
@Validated
public class TierProperties {

    /** Ordered cheapest to premium. */
    @Valid
    private List<TierDefinition> levels = new ArrayList<>();

    /** Results with fewer tags are escalated. */
    @Min(0)
    private int minTags = 5;

    /** Results with a shorter description are escalated. */
    @Min(0)
    private int minDescriptionLength = 50;

    /** Results with fewer populated tag categories are escalated. */
    @Min(0)
    private int minCategories = 2;

    public List<TierDefinition> getLevels() {
        return levels;
    }

    public void setLevels(List<TierDefinition> levels) {
        this.levels = levels;
    }

    public int getMinTags() {
        return minTags;
    }

    public void setMinTags(int minTags) {
        this.minTags = minTags;
    }

    public int getMinDescriptionLength() {
        return minDescriptionLength;
    }

    public void setMinDescriptionLength(int minDescriptionLength) {
        this.minDescriptionLength = minDescriptionLength;
    }

    public int getMinCategories() {
        return minCategories;
    }

    public void setMinCategories(int minCategories) {
        this.minCategories = minCategories;
    }

    /**
     * Converts the configured definitions to tiers, numbering levels in declaration order.
     */
    public List<Tier> toTiers() {
        List<Tier> tiers = new ArrayList<>(levels.size());
        for (int i = 0; i < levels.size(); i++) {
            TierDefinition d = levels.get(i);
            tiers.add(new Tier(d.getName(), i, d.getEstimatedCost()));
        }
        return List.copyOf(tiers);
    }

    /**
     * One configured tier.
     */
    public static class TierDefinition {
        @NotBlank
        private String name;

        @PositiveOrZero
        private double estimatedCost;

        public TierDefinition() {
        }

        public TierDefinition(String name, double estimatedCost) {
            this.name = name;
            this.estimatedCost = estimatedCost;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public double getEstimatedCost() {
            return estimatedCost;
        }

        public void setEstimatedCost(double estimatedCost) {
            this.estimatedCost = estimatedCost;
        }
    }
}
