package com.koni.thermoguard.domain.exception;

/**
 * Exception thrown when the caller's role does not allow the requested operation.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
