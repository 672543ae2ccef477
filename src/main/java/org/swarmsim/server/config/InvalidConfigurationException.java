package org.swarmsim.server.config;

/**
 * Thrown when simulation settings are rejected. Raised synchronously at creation time, before any
 * simulation instance exists.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(final String message) {
        super(message);
    }
}
