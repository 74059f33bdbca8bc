package com.koni.thermoguard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Control mode of a room. Only {@link #AUTOMATIC} rooms are driven by the hysteresis controller.
 */
public enum OperationMode {
    AUTOMATIC,
    MANUAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
