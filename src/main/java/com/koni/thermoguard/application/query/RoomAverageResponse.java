package com.koni.thermoguard.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Room-level averages over the latest reading of each online sensor.
 * An average is null when no online sensor reported that dimension.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RoomAverageResponse {

    private UUID roomId;
    private Double averageTemperature;
    private Double averageHumidity;
    private int sensorCount;
}
