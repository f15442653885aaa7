package com.rolefit.matcher.score;

/**
 * A signed change to a score, with the rule that produced it.
 *
 * @param reason      rule that fired
 * @param delta       signed change; positive for bonuses and boosts
 * @param description human-readable account of why the rule fired
 */
public record Adjustment(AdjustmentReason reason, double delta, String description) {

    public Adjustment {
        if (reason == null) {
            throw new IllegalArgumentException("Reason cannot be null");
        }
        if (Double.isNaN(delta)) {
            throw new IllegalArgumentException("Delta cannot be NaN");
        }
        description = description == null ? "" : description;
    }

    public ScoreComponent target() {
        return reason.getComponent();
    }
}
