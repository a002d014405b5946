package com.qoeguard.core.config;

/**
 * Thrown when scoring, policy or criticality configuration is malformed.
 * Raised eagerly at construction time; values are never clamped into range.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
