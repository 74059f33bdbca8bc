package com.koni.thermoguard.infrastructure.web.dto;

import java.time.Instant;

/**
 * DTO for error responses returned by the REST API.
 * {@code code} is the stable machine-readable error code; {@code message} is for humans.
 */
public class ErrorResponse {

    private final int status;
    private final String code;
    private final String message;
    private final Instant timestamp;

    public ErrorResponse(int status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
        this.timestamp = Instant.now();
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
