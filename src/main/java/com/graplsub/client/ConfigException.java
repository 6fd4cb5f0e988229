package com.graplsub.client;

/**
 * Raised when the environment does not describe a usable configuration.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
