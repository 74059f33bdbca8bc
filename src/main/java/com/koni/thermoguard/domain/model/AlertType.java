package com.koni.thermoguard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of alert the engine can raise. Cooldown deduplication is keyed on (room, type).
 */
public enum AlertType {
    HIGH_TEMP,
    LOW_TEMP,
    HIGH_HUMIDITY,
    LOW_HUMIDITY,
    SENSOR_OFFLINE,
    AC_ERROR,
    SYSTEM_ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
