package com.koni.thermoguard.domain.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationKind {
    SENSOR_READING,
    AC_STATUS_CHANGED,
    ALERT_TRIGGERED,
    CONNECTION_STATUS;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
