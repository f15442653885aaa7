package com.rolefit.matcher;

/**
 * Base exception for failures raised while scoring a candidate against a role.
 */
public class MatchingException extends RuntimeException {

    public MatchingException(String message) {
        super(message);
    }

    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
