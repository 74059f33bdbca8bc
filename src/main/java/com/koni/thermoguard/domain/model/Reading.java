package com.koni.thermoguard.domain.model;

import com.koni.thermoguard.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable temperature/humidity sample taken by a sensor.
 * At least one of the two measurements is present.
 */
@Getter
@EqualsAndHashCode(of = "id")
public class Reading {

    public static final double MIN_TEMPERATURE = -40.0;
    public static final double MAX_TEMPERATURE = 80.0;
    public static final double MIN_HUMIDITY = 0.0;
    public static final double MAX_HUMIDITY = 100.0;

    private final UUID id;
    private final UUID sensorId;
    private final Double temperature;
    private final Double humidity;
    private final Instant timestamp;

    public Reading(UUID id, UUID sensorId, Double temperature, Double humidity, Instant timestamp) {
        this.id = id;
        this.sensorId = sensorId;
        this.temperature = temperature;
        this.humidity = humidity;
        this.timestamp = timestamp;
    }

    /**
     * Creates a new reading, stamping it with the current time when no timestamp is supplied.
     */
    public static Reading create(UUID sensorId, Double temperature, Double humidity, Instant timestamp) {
        Reading reading = new Reading(UUID.randomUUID(), sensorId, temperature, humidity,
                timestamp != null ? timestamp : Instant.now());
        reading.validate();
        return reading;
    }

    /**
     * Checks the measured values against the physical ranges the sensors can produce.
     *
     * @throws ValidationException if both values are missing or one is out of range
     */
    public static void validateValues(Double temperature, Double humidity) {
        if (temperature == null && humidity == null) {
            throw new ValidationException("At least one of temperature or humidity is required");
        }
        if (temperature != null && (temperature.isNaN()
                || temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)) {
            throw new ValidationException("temperature must be between " + MIN_TEMPERATURE
                    + " and " + MAX_TEMPERATURE);
        }
        if (humidity != null && (humidity.isNaN() || humidity < MIN_HUMIDITY || humidity > MAX_HUMIDITY)) {
            throw new ValidationException("humidity must be between " + MIN_HUMIDITY + " and " + MAX_HUMIDITY);
        }
    }

    public void validate() {
        if (sensorId == null) {
            throw new ValidationException("sensorId is required");
        }
        validateValues(temperature, humidity);
    }

    public boolean hasTemperature() {
        return temperature != null;
    }

    public boolean hasHumidity() {
        return humidity != null;
    }

    @Override
    public String toString() {
        return "Reading{sensorId=" + sensorId + ", temperature=" + temperature
                + ", humidity=" + humidity + ", timestamp=" + timestamp + '}';
    }
}
