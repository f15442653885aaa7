package com.rolefit.matcher.document;

/**
 * Which side of a match a document stands on.
 */
public enum DocumentRole {
    CANDIDATE("candidate"),
    TARGET_ROLE("target-role");

    private final String label;

    DocumentRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
