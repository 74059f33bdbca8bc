package com.koni.thermoguard.infrastructure.web.exception;

/**
 * Thrown by controllers when an actuation was attempted and not delivered.
 * Mapped to 502 Bad Gateway with code {@code command_failed}.
 */
public class CommandFailedException extends RuntimeException {

    public CommandFailedException(String message) {
        super(message);
    }
}
