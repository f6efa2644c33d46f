package com.praier.monitor.config;

/**
 * Invalid or unreadable configuration. Only ever raised at startup.
 */
public class ConfigException extends IllegalStateException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
