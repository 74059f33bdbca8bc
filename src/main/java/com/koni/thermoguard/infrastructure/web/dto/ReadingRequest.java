package com.koni.thermoguard.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One reading as posted by a sensor.
 *
 * Contains:
 * - deviceId or sensorId: which sensor is reporting (one is required, sensorId wins when both are set)
 * - temperature, humidity: at least one is required
 * - timestamp: optional, ingestion time when absent
 *
 * Ranges are validated by the domain so single and bulk submissions report the same errors.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ReadingRequest {

    private String deviceId;

    private String sensorId;

    private Double temperature;

    private Double humidity;

    private Instant timestamp;

    public String identifier() {
        if (sensorId != null && !sensorId.isBlank()) {
            return sensorId;
        }
        return deviceId;
    }
}
