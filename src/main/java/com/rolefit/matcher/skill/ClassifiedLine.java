package com.rolefit.matcher.skill;

/**
 * One line of a role document with the section it sits in and the tier its skills get.
 *
 * @param text    the raw line
 * @param section the section state in effect for the line
 * @param tier    the tier applied to skills found on the line; differs from
 *                {@code section.tier()} only when the line carries its own marker
 * @param heading true when the line is a section heading
 */
public record ClassifiedLine(String text, SectionState section, SkillTier tier, boolean heading) {}
