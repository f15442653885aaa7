package com.rolefit.matcher.semantic;

import java.util.List;

/**
 * Semantic signal for one candidate/role pair.
 *
 * @param rawSimilarity best candidate-chunk cosine, floored at 0
 * @param boostFactor   multiplier applied to the raw similarity
 * @param score         {@code clamp(rawSimilarity * boostFactor)} in [0, 1]
 * @param topMatches    best chunks by similarity, earlier chunk first on ties
 */
public record SemanticScore(double rawSimilarity, double boostFactor, double score, List<ChunkMatch> topMatches) {

    public SemanticScore {
        topMatches = List.copyOf(topMatches);
    }

    /**
     * Change introduced by the boost, {@code score - rawSimilarity}.
     */
    public double boostDelta() {
        return score - rawSimilarity;
    }
}
