package com.raditha.cyclone.config;

/**
 * Invalid thresholds, bounds or configuration values. Always raised before
 * any source is processed.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
