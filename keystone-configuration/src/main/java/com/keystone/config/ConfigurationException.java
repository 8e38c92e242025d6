package com.keystone.config;

/**
 * Thrown when retry, backoff, threshold or settings values are invalid
 * (e.g. negative max retries, a circuit breaker threshold below 1, an unreadable settings file).
 */
public final class ConfigurationException extends RuntimeException {

    private final String setting;

    public ConfigurationException(String setting, String message) {
        super(setting != null ? setting + ": " + message : message);
        this.setting = setting;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.setting = null;
    }

    /** Name of the offending setting, or null when the failure is not tied to one value. */
    public String getSetting() {
        return setting;
    }
}
