package com.rolefit.matcher.score;

/**
 * Recruiter-facing band for a composite score.
 */
public enum MatchCategory {
    EXCELLENT(0.75, "Strong candidate - Recommend immediate interview"),
    GOOD(0.60, "Solid candidate - Review in detail"),
    MODERATE(0.45, "Some gaps exist - Consider with reservations"),
    LOW(0.0, "Significant gaps - May not be suitable");

    private final double minScore;
    private final String recommendation;

    MatchCategory(double minScore, String recommendation) {
        this.minScore = minScore;
        this.recommendation = recommendation;
    }

    public static MatchCategory forScore(double compositeScore) {
        for (MatchCategory category : values()) {
            if (compositeScore >= category.minScore) {
                return category;
            }
        }
        return LOW;
    }

    public double getMinScore() {
        return minScore;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
