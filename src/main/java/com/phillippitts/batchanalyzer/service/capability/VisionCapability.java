package com.phillippitts.batchanalyzer.service.capability;

import com.phillippitts.batchanalyzer.domain.Tier;
import com.phillippitts.batchanalyzer.exception.CapabilityException;

/**
 * Contract for the external vision capability that turns an image into an analysis.
 *
 * <p>Implementations wrap a concrete provider (hosted API, local model) behind one call per
 * tier. Each call is independent; the batch engine handles escalation, retries, call spacing
 * and budgeting.
 *
 * <p>Thread Safety: implementations must tolerate concurrent calls from several analysis slots.
 *
 * <p>Errors: every failure must surface as a {@link CapabilityException} whose kind tells the
 * engine whether another attempt can help. Unchecked exceptions of other types are treated as
 * transient failures.
 */
public interface VisionCapability {

    /**
     * Analyzes one image at the given tier.
     *
     * @param tier         requested tier (provider/model and cost level)
     * @param image        encoded image bytes
     * @param instructions instruction text describing the desired output
     * @return provider response including the actual cost incurred
     * @throws CapabilityException if the call fails
     */
    CapabilityResponse analyze(Tier tier, byte[] image, String instructions);

    /**
     * Name used in logs and health details.
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Whether the capability is configured and expected to accept calls.
     */
    default boolean isAvailable() {
        return true;
    }
}
