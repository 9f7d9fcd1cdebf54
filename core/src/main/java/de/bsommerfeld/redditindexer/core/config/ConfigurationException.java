package de.bsommerfeld.redditindexer.core.config;

/**
 * Thrown when the configuration file is missing, malformed or fails
 * validation. Always fatal at startup.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
