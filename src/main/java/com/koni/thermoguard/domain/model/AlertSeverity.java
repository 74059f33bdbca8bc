package com.koni.thermoguard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.koni.thermoguard.domain.exception.ValidationException;

import java.util.Locale;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertSeverity fromCode(String code) {
        for (AlertSeverity severity : values()) {
            if (severity.code().equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new ValidationException("Unknown alert severity: " + code);
    }
}
