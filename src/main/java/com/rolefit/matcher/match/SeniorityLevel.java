package com.rolefit.matcher.match;

import java.util.regex.Pattern;

/**
 * Seniority words in role titles and the years of experience they usually imply.
 * Used only when the role states no explicit number of years.
 */
public enum SeniorityLevel {
    INTERN(0, "intern|internship"),
    JUNIOR(1, "junior|entry[ -]level"),
    MIDDLE(3, "mid[ -]?level|intermediate"),
    SENIOR(5, "senior|sr\\."),
    LEAD(7, "lead|staff"),
    PRINCIPAL(10, "principal|distinguished");

    private final int impliedYears;
    private final Pattern pattern;

    SeniorityLevel(int impliedYears, String regex) {
        this.impliedYears = impliedYears;
        this.pattern = Pattern.compile("(?<![\\p{L}])(?:" + regex + ")(?![\\p{L}])", Pattern.CASE_INSENSITIVE);
    }

    public int getImpliedYears() {
        return impliedYears;
    }

    boolean foundIn(String text) {
        return pattern.matcher(text).find();
    }
}
