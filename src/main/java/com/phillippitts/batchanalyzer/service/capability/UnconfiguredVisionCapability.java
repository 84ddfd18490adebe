package com.phillippitts.batchanalyzer.service.capability;

import com.phillippitts.batchanalyzer.domain.Tier;
import com.phillippitts.batchanalyzer.exception.CapabilityException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Placeholder registered when no provider bean exists.
 *
 * <p>Every call fails with a non-retryable error so a run completes quickly with failed items
 * rather than retrying against nothing.
 */
public class UnconfiguredVisionCapability implements VisionCapability {

    private static final Logger LOG = LogManager.getLogger(UnconfiguredVisionCapability.class);

    public UnconfiguredVisionCapability() {
        LOG.warn("No VisionCapability bean configured; analysis calls will fail until a provider is registered");
    }

    @Override
    public CapabilityResponse analyze(Tier tier, byte[] image, String instructions) {
        throw CapabilityException.fatal(tier.name(), "No vision capability configured");
    }

    @Override
    public String getName() {
        return "unconfigured";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
