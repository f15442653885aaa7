package com.rolefit.matcher.score;

/**
 * Output of one scoring call.
 *
 * @param breakdown      sub-scores, adjustments and evidence
 * @param compositeScore final score in [0, 1], equal to the breakdown's composite
 * @param category       band derived from the composite score
 */
public record MatchResult(ScoreBreakdown breakdown, double compositeScore, MatchCategory category) {

    public MatchResult {
        if (breakdown == null) {
            throw new IllegalArgumentException("Breakdown cannot be null");
        }
        if (Double.compare(compositeScore, breakdown.getCompositeScore()) != 0) {
            throw new IllegalArgumentException("Composite score " + compositeScore
                + " does not match breakdown composite " + breakdown.getCompositeScore());
        }
    }

    public static MatchResult of(ScoreBreakdown breakdown) {
        return new MatchResult(breakdown, breakdown.getCompositeScore(),
            MatchCategory.forScore(breakdown.getCompositeScore()));
    }
}
