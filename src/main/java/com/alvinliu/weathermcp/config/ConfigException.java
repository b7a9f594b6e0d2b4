package com.alvinliu.weathermcp.config;

/**
 * Configuration could not be loaded. Fatal at startup.
 */
public class ConfigException extends Exception {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
