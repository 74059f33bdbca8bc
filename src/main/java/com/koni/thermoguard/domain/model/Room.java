package com.koni.thermoguard.domain.model;

import com.koni.thermoguard.domain.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * A monitored server room with its temperature and humidity setpoints.
 */
@Getter
@AllArgsConstructor
public class Room {

    public static final double DEFAULT_TARGET_TEMPERATURE = 22.0;
    public static final double DEFAULT_TARGET_HUMIDITY = 50.0;

    private static final double MIN_TARGET_TEMPERATURE = 16.0;
    private static final double MAX_TARGET_TEMPERATURE = 30.0;

    private final UUID id;
    private final String name;
    private final double targetTemperature;
    private final double targetHumidity;
    private final OperationMode operationMode;
    private final boolean active;

    /**
     * Creates an active, automatic room with the default setpoints.
     */
    public static Room create(String name) {
        return new Room(UUID.randomUUID(), name, DEFAULT_TARGET_TEMPERATURE, DEFAULT_TARGET_HUMIDITY,
                OperationMode.AUTOMATIC, true);
    }

    public boolean isAutomatic() {
        return operationMode == OperationMode.AUTOMATIC;
    }

    /**
     * Returns a copy with the given settings applied; null arguments keep the current value.
     */
    public Room withSettings(Double targetTemperature, Double targetHumidity, OperationMode operationMode) {
        Room updated = new Room(
                id,
                name,
                targetTemperature != null ? targetTemperature : this.targetTemperature,
                targetHumidity != null ? targetHumidity : this.targetHumidity,
                operationMode != null ? operationMode : this.operationMode,
                active
        );
        updated.validate();
        return updated;
    }

    /**
     * @throws ValidationException if a setpoint falls outside its allowed range
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ValidationException("room name is required");
        }
        if (targetTemperature < MIN_TARGET_TEMPERATURE || targetTemperature > MAX_TARGET_TEMPERATURE) {
            throw new ValidationException("targetTemperature must be between "
                    + MIN_TARGET_TEMPERATURE + " and " + MAX_TARGET_TEMPERATURE);
        }
        if (targetHumidity < 0.0 || targetHumidity > 100.0) {
            throw new ValidationException("targetHumidity must be between 0 and 100");
        }
        if (operationMode == null) {
            throw new ValidationException("operationMode is required");
        }
    }

    @Override
    public String toString() {
        return "Room{id=" + id + ", name=" + name + ", targetTemperature=" + targetTemperature
                + ", targetHumidity=" + targetHumidity + ", operationMode=" + operationMode + '}';
    }
}
