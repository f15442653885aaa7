package com.rolefit.matcher.match;

import java.util.regex.Pattern;

/**
 * Ordinal scale of education levels, lowest first.
 *
 * <p>Undotted abbreviations (BS, BA, MS, MSc) only count when followed by "in", "degree",
 * "or" or a slash, so product names such as "MS SQL Server" are not read as degrees.
 */
public enum EducationLevel {
    HIGH_SCHOOL("high school|secondary school|ged"),
    ASSOCIATE("associate(?:'s)? degree|associates degree"),
    BACHELOR("bachelor(?:'s|s)?|b\\.sc?\\.?|b\\.a\\.?|(?:bsc?|ba)(?=\\s*/|\\s+(?:in|degree|or)\\b)"
        + "|b\\.?tech|b\\.e\\.|undergraduate degree"),
    MASTER("master(?:'s|s)?|m\\.sc?\\.?|msc?(?=\\s*/|\\s+(?:in|degree|or)\\b)"
        + "|m\\.?tech|mba|m\\.?eng|graduate degree"),
    DOCTORATE("ph\\.?d\\.?|doctorate|doctoral");

    private final Pattern pattern;

    EducationLevel(String regex) {
        this.pattern = Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + regex + ")(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE);
    }

    boolean foundIn(String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Number of tiers this level sits below another; zero or negative when it meets it.
     */
    public int tiersBelow(EducationLevel other) {
        return other.ordinal() - ordinal();
    }
}
