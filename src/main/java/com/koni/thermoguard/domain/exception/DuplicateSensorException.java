package com.koni.thermoguard.domain.exception;

public class DuplicateSensorException extends ConflictException {

    public DuplicateSensorException(String deviceId) {
        super("duplicate_sensor", "A sensor with deviceId " + deviceId + " is already registered");
    }
}
