package com.mco.core.config;

/**
 * Thrown when a workflow directory cannot be loaded: the directory is missing, or a
 * required document is absent or unreadable.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
