package com.courtster.pairing.engine;

/**
 * The engine cannot be built from the given roster or configuration.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }
}
