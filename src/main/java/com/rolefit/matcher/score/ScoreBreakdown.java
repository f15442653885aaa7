package com.rolefit.matcher.score;

import com.rolefit.matcher.config.ComponentWeights;
import com.rolefit.matcher.semantic.VectorMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Everything that went into a composite score.
 *
 * <p>The composite is a pure function of the sub-scores, the weights and the composite-stage
 * adjustments: {@link #recomputeComposite()} re-derives it bit for bit. Sub-score
 * adjustments (semantic boost, missing-skill penalty) are listed alongside but are already
 * part of the sub-score values.
 */
public final class ScoreBreakdown {

    private final SubScores subScores;
    private final ComponentWeights weights;
    private final double baseScore;
    private final List<Adjustment> adjustments;
    private final double compositeScore;
    private final MatchEvidence evidence;

    ScoreBreakdown(SubScores subScores, ComponentWeights weights, List<Adjustment> adjustments,
                   MatchEvidence evidence) {
        this.subScores = subScores;
        this.weights = copyOf(weights);
        this.baseScore = subScores.weightedSum(this.weights);
        this.adjustments = Collections.unmodifiableList(new ArrayList<>(adjustments));
        this.evidence = evidence == null ? MatchEvidence.EMPTY : evidence;
        this.compositeScore = applyCompositeAdjustments(baseScore, this.adjustments);
    }

    /**
     * Base score plus every composite-stage delta except the clamp, in order, then clamped
     * to [0, 1]. The clamp entry records the size of the clamp; it is not added.
     */
    static double applyCompositeAdjustments(double base, List<Adjustment> adjustments) {
        double running = base;
        for (Adjustment a : adjustments) {
            if (a.reason().isCompositeStage() && a.reason() != AdjustmentReason.COMPOSITE_CLAMP) {
                running += a.delta();
            }
        }
        return VectorMath.clamp01(running);
    }

    public double recomputeComposite() {
        return applyCompositeAdjustments(subScores.weightedSum(weights), adjustments);
    }

    public SubScores getSubScores() {
        return subScores;
    }

    public ComponentWeights getWeights() {
        return copyOf(weights);
    }

    /**
     * Weighted sum of the sub-scores before composite adjustments.
     */
    public double getBaseScore() {
        return baseScore;
    }

    public List<Adjustment> getAdjustments() {
        return adjustments;
    }

    public Optional<Adjustment> getAdjustment(AdjustmentReason reason) {
        return adjustments.stream().filter(a -> a.reason() == reason).findFirst();
    }

    public boolean hasAdjustment(AdjustmentReason reason) {
        return getAdjustment(reason).isPresent();
    }

    public double getCompositeScore() {
        return compositeScore;
    }

    public MatchEvidence getEvidence() {
        return evidence;
    }

    private static ComponentWeights copyOf(ComponentWeights w) {
        return new ComponentWeights(w.getTechnicalSkill(), w.getSemantic(), w.getExperience(), w.getEducation());
    }

    @Override
    public String toString() {
        return String.format("ScoreBreakdown{subScores=%s, weights=%s, base=%.4f, adjustments=%s, composite=%.4f}",
            subScores, weights, baseScore, adjustments, compositeScore);
    }
}
