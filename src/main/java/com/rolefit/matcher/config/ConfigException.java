package com.rolefit.matcher.config;

import com.rolefit.matcher.MatchingException;

/**
 * Thrown when scoring configuration is structurally invalid.
 * Raised before any document text is processed.
 */
public class ConfigException extends MatchingException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
