package com.rolefit.matcher.document;

/**
 * Immutable document text tagged with the side of the match it belongs to.
 * A document has no identity beyond its content.
 *
 * @param text the plain text supplied by the caller
 * @param role candidate or target role
 */
public record Document(String text, DocumentRole role) {

    public Document {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
    }

    public static Document candidate(String text) {
        return new Document(text, DocumentRole.CANDIDATE);
    }

    public static Document targetRole(String text) {
        return new Document(text, DocumentRole.TARGET_ROLE);
    }

    /**
     * True when the text holds nothing but whitespace.
     */
    public boolean isBlank() {
        return text.isBlank();
    }
}
