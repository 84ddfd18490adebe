package com.phillippitts.batchanalyzer.service.grouping;

import com.phillippitts.batchanalyzer.domain.Fingerprint;
import com.phillippitts.batchanalyzer.domain.HashAlgorithm;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Fingerprints computed for one item. An empty map marks an item that could not be hashed.
 *
 * @param itemId       item identifier
 * @param fingerprints algorithm to fingerprint
 */
public record ItemFingerprints(String itemId, Map<HashAlgorithm, Fingerprint> fingerprints) {

    public ItemFingerprints {
        Objects.requireNonNull(itemId, "itemId");
        fingerprints = fingerprints == null ? Map.of() : Map.copyOf(fingerprints);
    }

    public static ItemFingerprints unhashable(String itemId) {
        return new ItemFingerprints(itemId, Map.of());
    }

    /**
     * True when a fingerprint exists for every required algorithm.
     */
    public boolean covers(Collection<HashAlgorithm> required) {
        return fingerprints.keySet().containsAll(required);
    }
}
