package com.koni.thermoguard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * An edge device reporting readings for one room, identified on the wire by its device id.
 */
@Getter
@AllArgsConstructor
public class Sensor {

    private final UUID id;
    private final UUID roomId;
    private final String deviceId;
    private final String name;
    private final boolean online;
    private final Instant lastSeen;

    public static Sensor register(UUID roomId, String deviceId, String name) {
        return new Sensor(UUID.randomUUID(), roomId, deviceId, name, false, null);
    }

    @Override
    public String toString() {
        return "Sensor{id=" + id + ", deviceId=" + deviceId + ", roomId=" + roomId + ", online=" + online + '}';
    }
}
