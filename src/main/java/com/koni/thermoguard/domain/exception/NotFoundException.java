package com.koni.thermoguard.domain.exception;

/**
 * Exception thrown when a referenced room, sensor, air conditioner or alert does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
