package com.phillippitts.batchanalyzer.service.health;

import com.phillippitts.batchanalyzer.domain.Tier;
import com.phillippitts.batchanalyzer.service.capability.VisionCapability;
import com.phillippitts.batchanalyzer.service.tier.TierSelector;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the vision capability.
 *
 * <ul>
 *   <li>UP: a capability is configured and at least one tier is defined</li>
 *   <li>DOWN: no capability or no tiers; every run would fail or be rejected</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CapabilityHealthIndicator implements HealthIndicator {

    private final VisionCapability capability;
    private final TierSelector tierSelector;

    public CapabilityHealthIndicator(VisionCapability capability, TierSelector tierSelector) {
        this.capability = capability;
        this.tierSelector = tierSelector;
    }

    @Override
    public Health health() {
        boolean available = capability.isAvailable();
        int tiers = tierSelector.tiers().size();
        Health.Builder builder = available && tiers > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("capability", capability.getName())
                .withDetail("available", available)
                .withDetail("tiers", tierSelector.tiers().stream().map(Tier::name).toList())
                .build();
    }
}
