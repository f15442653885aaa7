package com.rolefit.matcher.document;

import com.rolefit.matcher.MatchingException;

/**
 * Thrown when a document is empty after trimming. No partial score is produced.
 */
public class EmptyInputException extends MatchingException {

    private final DocumentRole role;

    public EmptyInputException(DocumentRole role) {
        super(role.getLabel() + " document is empty");
        this.role = role;
    }

    public DocumentRole getRole() {
        return role;
    }
}
