package com.phillippitts.batchanalyzer.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimilarityGroupTest {

    @Test
    void representativeConfidenceIsAlwaysOne() {
        SimilarityGroup group = new SimilarityGroup("a", List.of("a", "b"), Map.of("a", 0.3, "b", 0.95), null);

        assertThat(group.confidenceOf("a")).isEqualTo(1.0);
        assertThat(group.confidenceOf("b")).isEqualTo(0.95);
        assertThat(group.derivedMemberIds()).containsExactly("b");
        assertThat(group.size()).isEqualTo(2);
    }

    @Test
    void singletonHasOnlyTheRepresentative() {
        SimilarityGroup group = SimilarityGroup.singleton("x");

        assertThat(group.isSingleton()).isTrue();
        assertThat(group.derivedMemberIds()).isEmpty();
        assertThat(group.cachedResult()).isEmpty();
    }

    @Test
    void withRepresentativeResultReturnsNewGroup() {
        SimilarityGroup group = SimilarityGroup.singleton("x");
        AnalysisResult result = new AnalysisResult("d", Map.of(), null, 0.0, "local", 1.0, null, null);

        SimilarityGroup analyzed = group.withRepresentativeResult(result);

        assertThat(analyzed.cachedResult()).contains(result);
        assertThat(group.cachedResult()).isEmpty();
    }

    @Test
    void shouldRejectRepresentativeNotFirst() {
        assertThatThrownBy(() -> new SimilarityGroup("b", List.of("a", "b"), Map.of("a", 0.9), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("first member");
    }

    @Test
    void shouldRejectMissingMemberConfidence() {
        assertThatThrownBy(() -> new SimilarityGroup("a", List.of("a", "b"), Map.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("member b");
    }

    @Test
    void unknownMemberIsRejected() {
        SimilarityGroup group = SimilarityGroup.singleton("x");

        assertThatThrownBy(() -> group.confidenceOf("y"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
