package com.koni.thermoguard.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.koni.thermoguard.domain.exception.ValidationException;

import java.util.Locale;

/**
 * Infrared commands an air conditioner can learn and replay.
 */
public enum IrCommandType {
    POWER_ON,
    POWER_OFF,
    TEMP_UP,
    TEMP_DOWN,
    MODE_COOL,
    MODE_HEAT,
    MODE_AUTO,
    FAN_LOW,
    FAN_MED,
    FAN_HIGH;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the wire code ({@code power_on}, {@code fan_high}, ...).
     *
     * @throws ValidationException if the code is blank or unknown
     */
    @JsonCreator
    public static IrCommandType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("commandType is required");
        }
        for (IrCommandType type : values()) {
            if (type.code().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new ValidationException("Unknown IR command type: " + code);
    }
}
