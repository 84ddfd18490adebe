package com.phillippitts.batchanalyzer.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A set of near-duplicate items sharing one representative.
 *
 * <p>The representative is always the first member and always has confidence 1.0. Other members
 * carry their similarity to the representative as confidence.
 *
 * @param representativeId     id of the item whose result is computed directly
 * @param memberIds            all member ids, representative first
 * @param confidences          member id to confidence in [0,1]
 * @param representativeResult cached result for the representative, null until analyzed
 */
public record SimilarityGroup(
        String representativeId,
        List<String> memberIds,
        Map<String, Double> confidences,
        AnalysisResult representativeResult
) {

    public SimilarityGroup {
        Objects.requireNonNull(representativeId, "representativeId");
        memberIds = List.copyOf(memberIds);
        if (memberIds.isEmpty() || !memberIds.get(0).equals(representativeId)) {
            throw new IllegalArgumentException("Representative must be the first member");
        }
        Map<String, Double> copy = new LinkedHashMap<>(confidences);
        copy.put(representativeId, 1.0);
        for (String id : memberIds) {
            Double c = copy.get(id);
            if (c == null || c < 0.0 || c > 1.0) {
                throw new IllegalArgumentException("Missing or out-of-range confidence for member " + id);
            }
        }
        confidences = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a singleton group for an item that cannot be compared with others.
     */
    public static SimilarityGroup singleton(String itemId) {
        return new SimilarityGroup(itemId, List.of(itemId), Map.of(itemId, 1.0), null);
    }

    public int size() {
        return memberIds.size();
    }

    public boolean isSingleton() {
        return memberIds.size() == 1;
    }

    public double confidenceOf(String memberId) {
        Double c = confidences.get(memberId);
        if (c == null) {
            throw new IllegalArgumentException("Not a member of this group: " + memberId);
        }
        return c;
    }

    /** Members other than the representative, in grouping order. */
    public List<String> derivedMemberIds() {
        return memberIds.subList(1, memberIds.size());
    }

    public Optional<AnalysisResult> cachedResult() {
        return Optional.ofNullable(representativeResult);
    }

    public SimilarityGroup withRepresentativeResult(AnalysisResult result) {
        return new SimilarityGroup(representativeId, memberIds, confidences, result);
    }
}
