package com.rolefit.matcher.skill;

/**
 * Where the section classifier currently is within a role document.
 *
 * <p>Every state maps to exactly one {@link SkillTier}. Text before any recognised
 * heading, or under a heading that names neither tier, is {@link #UNCLASSIFIED} and
 * counts as required.
 */
public enum SectionState {
    UNDER_REQUIRED_HEADING(SkillTier.REQUIRED),
    UNDER_PREFERRED_HEADING(SkillTier.PREFERRED),
    UNCLASSIFIED(SkillTier.REQUIRED);

    private final SkillTier tier;

    SectionState(SkillTier tier) {
        this.tier = tier;
    }

    public SkillTier tier() {
        return tier;
    }
}
