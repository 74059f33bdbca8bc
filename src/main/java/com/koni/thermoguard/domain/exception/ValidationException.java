package com.koni.thermoguard.domain.exception;

/**
 * Exception thrown when input does not meet the domain's rules.
 * Reported to callers as a 400 with code {@code validation_error}.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
