package com.rolefit.matcher.score;

/**
 * The scored dimensions of a match. The first four are sub-scores; {@link #COMPOSITE}
 * is the weighted total.
 */
public enum ScoreComponent {
    TECHNICAL_SKILL("technical_skill"),
    SEMANTIC("semantic"),
    EXPERIENCE("experience"),
    EDUCATION("education"),
    COMPOSITE("composite");

    private final String key;

    ScoreComponent(String key) {
        this.key = key;
    }

    /**
     * Stable lowercase name used in reports.
     */
    public String getKey() {
        return key;
    }
}
