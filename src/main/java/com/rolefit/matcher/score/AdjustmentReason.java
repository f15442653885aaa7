package com.rolefit.matcher.score;

/**
 * Why a score was moved away from its plain computed value.
 *
 * <p>Sub-score adjustments are already folded into the sub-score they target and are listed
 * for transparency. Composite adjustments are applied, in list order, on top of the
 * weighted base score.
 */
public enum AdjustmentReason {
    SEMANTIC_BOOST(ScoreComponent.SEMANTIC),
    MISSING_SKILL_PENALTY(ScoreComponent.TECHNICAL_SKILL),
    CROSS_DOMAIN_BONUS(ScoreComponent.COMPOSITE),
    COMPOSITE_CLAMP(ScoreComponent.COMPOSITE);

    private final ScoreComponent component;

    AdjustmentReason(ScoreComponent component) {
        this.component = component;
    }

    public ScoreComponent getComponent() {
        return component;
    }

    public boolean isCompositeStage() {
        return component == ScoreComponent.COMPOSITE;
    }
}
