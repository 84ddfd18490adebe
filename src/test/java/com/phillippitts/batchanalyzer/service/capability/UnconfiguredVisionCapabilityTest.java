package com.phillippitts.batchanalyzer.service.capability;

import com.phillippitts.batchanalyzer.domain.Tier;
import com.phillippitts.batchanalyzer.exception.CapabilityException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnconfiguredVisionCapabilityTest {

    @Test
    void failsEveryCallPermanently() {
        UnconfiguredVisionCapability capability = new UnconfiguredVisionCapability();

        assertThat(capability.isAvailable()).isFalse();
        assertThatThrownBy(() -> capability.analyze(new Tier("local", 0, 0.0), new byte[0], "describe"))
                .isInstanceOfSatisfying(CapabilityException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(CapabilityException.Kind.FATAL);
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    void responseConvertsToResultOfItsTier() {
        CapabilityResponse response = new CapabilityResponse("A red door.", Map.of("color", List.of("red")),
                null, 0.002, 0.7, null);

        var result = response.toResult(new Tier("budget", 1, 0.0025));

        assertThat(result.tier()).isEqualTo("budget");
        assertThat(result.cost()).isEqualTo(0.002);
        assertThat(result.confidence()).isEqualTo(0.7);
        assertThat(result.generatedPrompt()).isEmpty();
    }

    @Test
    void responseRejectsZeroConfidence() {
        assertThatThrownBy(() -> new CapabilityResponse("x", null, null, 0.0, 0.0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
