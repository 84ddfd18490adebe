package com.phillippitts.batchanalyzer.service.propagation;

import com.phillippitts.batchanalyzer.domain.AnalysisResult;
import com.phillippitts.batchanalyzer.domain.SimilarityGroup;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies a representative's result onto the other members of its group.
 *
 * <p>Derived results carry the representative's description, tags and prompt at zero cost,
 * are marked with tier {@value AnalysisResult#DERIVED_TIER} and remember the source tier.
 * Their confidence is the representative's confidence scaled by the member's similarity.
 */
@Component
public class ResultPropagator {

    /**
     * Derives one member's result.
     *
     * @param source     representative's result
     * @param similarity member's similarity to the representative, in (0,1]
     */
    public AnalysisResult derive(AnalysisResult source, double similarity) {
        if (similarity <= 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("Similarity must be in (0,1], got: " + similarity);
        }
        if (source.isDerived()) {
            throw new IllegalArgumentException("Cannot derive from a derived result");
        }
        return new AnalysisResult(
                source.description(),
                source.tags(),
                source.prompt(),
                0.0,
                AnalysisResult.DERIVED_TIER,
                source.confidence() * similarity,
                source.tier(),
                null);
    }

    /**
     * Derives results for every non-representative member of an analyzed group.
     *
     * @return member id to derived result, in group order
     * @throws IllegalStateException if the group has no cached representative result
     */
    public Map<String, AnalysisResult> propagate(SimilarityGroup group) {
        AnalysisResult source = group.cachedResult().orElseThrow(() ->
                new IllegalStateException("Group " + group.representativeId() + " has not been analyzed"));
        Map<String, AnalysisResult> out = new LinkedHashMap<>();
        for (String memberId : group.derivedMemberIds()) {
            out.put(memberId, derive(source, group.confidenceOf(memberId)));
        }
        return Collections.unmodifiableMap(out);
    }
}
