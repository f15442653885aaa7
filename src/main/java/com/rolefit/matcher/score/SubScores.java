package com.rolefit.matcher.score;

import com.rolefit.matcher.config.ComponentWeights;

/**
 * The four sub-scores of a match, each in [0, 1].
 */
public record SubScores(double technicalSkill, double semantic, double experience, double education) {

    public SubScores {
        requireUnit(ScoreComponent.TECHNICAL_SKILL, technicalSkill);
        requireUnit(ScoreComponent.SEMANTIC, semantic);
        requireUnit(ScoreComponent.EXPERIENCE, experience);
        requireUnit(ScoreComponent.EDUCATION, education);
    }

    public double get(ScoreComponent component) {
        return switch (component) {
            case TECHNICAL_SKILL -> technicalSkill;
            case SEMANTIC -> semantic;
            case EXPERIENCE -> experience;
            case EDUCATION -> education;
            case COMPOSITE -> throw new IllegalArgumentException("Composite is not a sub-score");
        };
    }

    /**
     * Weighted sum, always evaluated in the same term order.
     */
    public double weightedSum(ComponentWeights weights) {
        return weights.getTechnicalSkill() * technicalSkill
            + weights.getSemantic() * semantic
            + weights.getExperience() * experience
            + weights.getEducation() * education;
    }

    private static void requireUnit(ScoreComponent component, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(
                "Sub-score '" + component.getKey() + "' must be between 0.0 and 1.0, got " + value);
        }
    }
}
