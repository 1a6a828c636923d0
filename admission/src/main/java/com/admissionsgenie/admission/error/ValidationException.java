package com.admissionsgenie.admission.error;

/**
 * Thrown when an evaluation request is invalid. No partial result is produced.
 */
public class ValidationException extends RuntimeException {
    private final ValidationError error;

    public ValidationException(ValidationError error, String message) {
        super(message);
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }
}
