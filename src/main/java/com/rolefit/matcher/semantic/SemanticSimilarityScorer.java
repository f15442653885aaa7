package com.rolefit.matcher.semantic;

import com.rolefit.matcher.config.ScoringConfig;
import com.rolefit.matcher.document.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the boosted semantic sub-score from chunk vectors.
 *
 * <p>The role side is collapsed to one vector, the element-wise mean of its chunk vectors.
 * Each candidate chunk is compared with that vector by cosine similarity and the best chunk
 * sets the raw similarity. Negative similarities count as zero. The raw value is then
 * multiplied by the configured boost factor and clamped to [0, 1].
 */
public class SemanticSimilarityScorer {

    private static final Logger log = LoggerFactory.getLogger(SemanticSimilarityScorer.class);

    private static final Comparator<ChunkMatch> BEST_FIRST =
        Comparator.comparingDouble(ChunkMatch::similarity).reversed()
            .thenComparingInt(m -> m.chunk().index());

    public SemanticScore score(List<Chunk> candidateChunks, List<float[]> candidateVectors,
                               List<float[]> roleVectors, ScoringConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        return score(candidateChunks, candidateVectors, roleVectors,
            config.getSemanticBoostFactor(), config.getTopMatchCount());
    }

    /**
     * Score candidate chunks against the role.
     *
     * @param candidateChunks  candidate chunks, in document order
     * @param candidateVectors one vector per candidate chunk, same order
     * @param roleVectors      one vector per role chunk
     * @param boostFactor      calibration multiplier for the raw similarity
     * @param topN             number of best chunks to report
     */
    public SemanticScore score(List<Chunk> candidateChunks, List<float[]> candidateVectors,
                               List<float[]> roleVectors, double boostFactor, int topN) {
        if (candidateChunks == null || candidateVectors == null || roleVectors == null) {
            throw new IllegalArgumentException("Chunks and vectors cannot be null");
        }
        if (candidateChunks.size() != candidateVectors.size()) {
            throw new IllegalArgumentException("Expected one vector per candidate chunk: chunks="
                + candidateChunks.size() + ", vectors=" + candidateVectors.size());
        }
        if (candidateChunks.isEmpty() || roleVectors.isEmpty()) {
            return new SemanticScore(0.0, boostFactor, 0.0, List.of());
        }

        float[] roleVector = aggregateRole(roleVectors);

        List<ChunkMatch> matches = new ArrayList<>(candidateChunks.size());
        for (int i = 0; i < candidateChunks.size(); i++) {
            float[] v = candidateVectors.get(i);
            if (v.length != roleVector.length) {
                throw new ProviderException("Embedding dimension mismatch: candidate chunk " + i
                    + " has " + v.length + ", role has " + roleVector.length);
            }
            matches.add(new ChunkMatch(candidateChunks.get(i), VectorMath.cosine(v, roleVector)));
        }

        matches.sort(BEST_FIRST);
        double raw = Math.max(0.0, matches.get(0).similarity());
        double boosted = VectorMath.clamp01(raw * boostFactor);
        List<ChunkMatch> top = matches.subList(0, Math.min(topN, matches.size()));

        log.debug("Semantic score: raw={}, boost={}, boosted={}, chunks={}",
                  raw, boostFactor, boosted, candidateChunks.size());
        return new SemanticScore(raw, boostFactor, boosted, top);
    }

    /**
     * The single comparison vector for the role document.
     */
    public float[] aggregateRole(List<float[]> roleVectors) {
        try {
            return VectorMath.mean(roleVectors);
        } catch (IllegalArgumentException e) {
            throw new ProviderException("Inconsistent role embeddings: " + e.getMessage(), e);
        }
    }
}
