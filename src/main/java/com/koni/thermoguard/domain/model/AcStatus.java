package com.koni.thermoguard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Last known state of an air conditioner.
 * {@link #ERROR} is reserved for operator-driven transitions; the actuation path never sets it.
 */
public enum AcStatus {
    ON,
    OFF,
    ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
