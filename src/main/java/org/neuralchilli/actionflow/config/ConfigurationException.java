package org.neuralchilli.actionflow.config;

/**
 * Thrown when a configuration value makes a capability unusable.
 * Fatal only to the capability reading the value.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
