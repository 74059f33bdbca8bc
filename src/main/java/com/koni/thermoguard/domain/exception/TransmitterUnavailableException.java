package com.koni.thermoguard.domain.exception;

/**
 * Exception thrown when an IR command cannot be handed to the transmitter channel.
 * The actuation path converts it into a failed command; it never reaches HTTP callers.
 */
public class TransmitterUnavailableException extends RuntimeException {

    public TransmitterUnavailableException(String message) {
        super(message);
    }

    public TransmitterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
