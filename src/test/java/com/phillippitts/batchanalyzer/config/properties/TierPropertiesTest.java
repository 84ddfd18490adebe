package com.phillippitts.batchanalyzer.config.properties;

import com.phillippitts.batchanalyzer.domain.Tier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TierPropertiesTest {

    @Test
    void levelsAreNumberedInDeclarationOrder() {
        TierProperties props = new TierProperties();
        props.setLevels(List.of(
                new TierProperties.TierDefinition("local", 0.0),
                new TierProperties.TierDefinition("balanced", 0.01),
                new TierProperties.TierDefinition("premium", 0.03)));

        List<Tier> tiers = props.toTiers();

        assertThat(tiers).containsExactly(
                new Tier("local", 0, 0.0),
                new Tier("balanced", 1, 0.01),
                new Tier("premium", 2, 0.03));
    }

    @Test
    void sufficiencyThresholdsHaveDefaults() {
        TierProperties props = new TierProperties();

        assertThat(props.getMinTags()).isEqualTo(5);
        assertThat(props.getMinDescriptionLength()).isEqualTo(50);
        assertThat(props.getMinCategories()).isEqualTo(2);
    }
}
