package com.rolefit.matcher.score;

import com.rolefit.matcher.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges the four sub-scores into one composite score.
 *
 * <p>Order of operations: weighted base sum, cross-domain bonus, clamp to [0, 1]. The
 * missing-skill penalty and semantic boost happen upstream, inside the sub-scores, and are
 * passed in only so the breakdown can list them.
 */
public class HybridScoreCombiner {

    private static final Logger log = LoggerFactory.getLogger(HybridScoreCombiner.class);

    private final ScoringConfig config;

    /**
     * @throws com.rolefit.matcher.config.ConfigException if the configuration is invalid
     */
    public HybridScoreCombiner(ScoringConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config.validate();
    }

    public ScoreBreakdown combine(double technicalSkill, double semantic, double experience, double education) {
        return combine(new SubScores(technicalSkill, semantic, experience, education), List.of(), MatchEvidence.EMPTY);
    }

    /**
     * Combine sub-scores into a breakdown.
     *
     * @param subScores           the four sub-scores
     * @param upstreamAdjustments sub-score adjustments already folded into {@code subScores}
     * @param evidence            matched/missing skills and top passages
     */
    public ScoreBreakdown combine(SubScores subScores, List<Adjustment> upstreamAdjustments, MatchEvidence evidence) {
        if (subScores == null) {
            throw new IllegalArgumentException("Sub-scores cannot be null");
        }
        List<Adjustment> adjustments = new ArrayList<>();
        for (Adjustment a : upstreamAdjustments) {
            if (a.reason().isCompositeStage()) {
                throw new IllegalArgumentException("Composite adjustment passed as upstream: " + a.reason());
            }
            adjustments.add(a);
        }

        double base = subScores.weightedSum(config.getComponentWeights());

        if (subScores.semantic() > config.getCrossDomainSemanticThreshold()
                && subScores.technicalSkill() < config.getCrossDomainKeywordThreshold()) {
            adjustments.add(new Adjustment(AdjustmentReason.CROSS_DOMAIN_BONUS, config.getCrossDomainBonus(),
                String.format("Semantic fit %.2f above %.2f with keyword fit %.2f below %.2f",
                    subScores.semantic(), config.getCrossDomainSemanticThreshold(),
                    subScores.technicalSkill(), config.getCrossDomainKeywordThreshold())));
        }

        double unclamped = base;
        for (Adjustment a : adjustments) {
            if (a.reason().isCompositeStage()) {
                unclamped += a.delta();
            }
        }
        if (unclamped > 1.0 || unclamped < 0.0) {
            double clamped = Math.max(0.0, Math.min(1.0, unclamped));
            adjustments.add(new Adjustment(AdjustmentReason.COMPOSITE_CLAMP, clamped - unclamped,
                String.format("Composite %.4f clamped to %.1f", unclamped, clamped)));
        }

        ScoreBreakdown breakdown = new ScoreBreakdown(subScores, config.getComponentWeights(), adjustments, evidence);
        log.debug("Combined: base={}, adjustments={}, composite={}",
                  base, adjustments.size(), breakdown.getCompositeScore());
        return breakdown;
    }

    public ScoringConfig getConfig() {
        return config;
    }
}
