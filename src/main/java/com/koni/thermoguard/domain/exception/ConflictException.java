package com.koni.thermoguard.domain.exception;

/**
 * Exception thrown when an operation collides with the current state of an entity.
 * Subclasses carry the error code reported to the caller.
 */
public class ConflictException extends RuntimeException {

    private final String code;

    public ConflictException(String message) {
        this("conflict", message);
    }

    protected ConflictException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
