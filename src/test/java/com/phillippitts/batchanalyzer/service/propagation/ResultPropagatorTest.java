package com.phillippitts.batchanalyzer.service.propagation;

import com.phillippitts.batchanalyzer.domain.AnalysisResult;
import com.phillippitts.batchanalyzer.domain.SimilarityGroup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResultPropagatorTest {

    private final ResultPropagator propagator = new ResultPropagator();

    private static final AnalysisResult SOURCE = new AnalysisResult(
            "Two cats asleep on a windowsill in afternoon light.",
            Map.of("subject", List.of("cat", "window")),
            "two cats sleeping, warm light",
            0.01,
            "balanced",
            0.8,
            null,
            "{\"id\":1}");

    @Test
    void derivedResultCopiesContentAtZeroCost() {
        AnalysisResult derived = propagator.derive(SOURCE, 0.95);

        assertThat(derived.description()).isEqualTo(SOURCE.description());
        assertThat(derived.tags()).isEqualTo(SOURCE.tags());
        assertThat(derived.prompt()).isEqualTo(SOURCE.prompt());
        assertThat(derived.cost()).isZero();
        assertThat(derived.tier()).isEqualTo(AnalysisResult.DERIVED_TIER);
        assertThat(derived.isDerived()).isTrue();
        assertThat(derived.sourceTier()).isEqualTo("balanced");
        assertThat(derived.raw()).isNull();
    }

    @Test
    void confidenceIsScaledBySimilarity() {
        assertThat(propagator.derive(SOURCE, 0.95).confidence()).isCloseTo(0.76, within(1e-12));
        assertThat(propagator.derive(SOURCE, 1.0).confidence()).isEqualTo(0.8);
    }

    @Test
    void propagatesToEveryNonRepresentativeMemberInOrder() {
        SimilarityGroup group = new SimilarityGroup("a", List.of("a", "c", "b"),
                Map.of("c", 0.97, "b", 0.92), null).withRepresentativeResult(SOURCE);

        Map<String, AnalysisResult> derived = propagator.propagate(group);

        assertThat(derived).containsOnlyKeys("c", "b");
        assertThat(derived.keySet()).containsExactly("c", "b");
        assertThat(derived.get("b").confidence()).isCloseTo(0.8 * 0.92, within(1e-12));
    }

    @Test
    void singletonGroupDerivesNothing() {
        SimilarityGroup group = SimilarityGroup.singleton("solo").withRepresentativeResult(SOURCE);

        assertThat(propagator.propagate(group)).isEmpty();
    }

    @Test
    void unanalyzedGroupCannotBePropagated() {
        SimilarityGroup group = new SimilarityGroup("a", List.of("a", "b"), Map.of("b", 0.95), null);

        assertThatThrownBy(() -> propagator.propagate(group))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("a");
    }

    @Test
    void rejectsDerivingFromDerivedResult() {
        AnalysisResult derived = propagator.derive(SOURCE, 0.95);

        assertThatThrownBy(() -> propagator.derive(derived, 0.95)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsSimilarityOutsideUnitInterval() {
        assertThatThrownBy(() -> propagator.derive(SOURCE, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> propagator.derive(SOURCE, 1.01)).isInstanceOf(IllegalArgumentException.class);
    }
}
