package com.example.covenant.config;

/**
 * Raised when tuning constants or catalog data are missing or malformed.
 * Fatal: a session cannot be created from a configuration that fails to load.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
