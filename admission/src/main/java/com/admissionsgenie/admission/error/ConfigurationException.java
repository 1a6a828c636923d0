package com.admissionsgenie.admission.error;

/**
 * Thrown when configuration records cannot support an evaluation. Points the user at fixing the
 * configuration rather than their request.
 */
public class ConfigurationException extends RuntimeException {
    private final ConfigurationError error;

    public ConfigurationException(ConfigurationError error, String message) {
        super(message);
        this.error = error;
    }

    public ConfigurationError error() {
        return error;
    }
}
