package com.rolefit.matcher.skill;

/**
 * How mandatory a role-side skill is.
 */
public enum SkillTier {
    REQUIRED,
    PREFERRED
}
