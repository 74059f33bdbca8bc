package com.koni.thermoguard.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Query for sensors with their latest reading, optionally limited to one room.
 */
@Getter
@AllArgsConstructor
public class GetSensorsQuery {

    /**
     * Room to list; all rooms when null.
     */
    private final UUID roomId;
}
