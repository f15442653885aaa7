package com.rolefit.matcher.semantic;

import com.rolefit.matcher.MatchingException;

/**
 * Exception thrown when an embedding or explanation provider fails.
 * Wraps transport and response-parsing failures.
 */
public class ProviderException extends MatchingException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
