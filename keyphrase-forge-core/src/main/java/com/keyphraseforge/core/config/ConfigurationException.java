package com.keyphraseforge.core.config;

/**
 * Thrown when pipeline configuration is missing, unreadable or invalid.
 *
 * <p>This is the only failure that aborts a run. It is always raised before any
 * extraction call is issued.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
