package io.cadence.core;

/**
 * Rejected input: a missing cadence field, a blank name or command, or an unsupported context value.
 * Raised before any job state is touched.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public static ValidationException missingField(String frequency, String field) {
        return new ValidationException(field + " is required for " + frequency + " jobs");
    }
}
