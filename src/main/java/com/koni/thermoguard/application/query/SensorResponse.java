package com.koni.thermoguard.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A sensor with its liveness state and latest reading, as the dashboard shows it.
 * The reading fields are null when the sensor never reported.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SensorResponse {

    private UUID sensorId;
    private UUID roomId;
    private String deviceId;
    private String name;
    private boolean online;
    private Instant lastSeen;
    private Double temperature;
    private Double humidity;
    private Instant readingTimestamp;
}
