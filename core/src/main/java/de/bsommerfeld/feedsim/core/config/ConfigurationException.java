package de.bsommerfeld.feedsim.core.config;

/**
 * Thrown when the configuration file cannot be read, written or validated.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
