package com.koni.thermoguard.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * An infrared-controlled air conditioner in a room.
 * {@code irCodes} holds the learned raw signal per command.
 */
@Getter
public class AirConditioner {

    private final UUID id;
    private final UUID roomId;
    private final String name;
    private final String transmitterDeviceId;
    private final boolean active;
    private final Map<IrCommandType, String> irCodes;
    private AcStatus status;
    private Instant lastCommand;

    public AirConditioner(UUID id, UUID roomId, String name, String transmitterDeviceId, boolean active,
                          AcStatus status, Map<IrCommandType, String> irCodes, Instant lastCommand) {
        this.id = id;
        this.roomId = roomId;
        this.name = name;
        this.transmitterDeviceId = transmitterDeviceId;
        this.active = active;
        this.status = status;
        this.irCodes = irCodes == null || irCodes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(irCodes));
        this.lastCommand = lastCommand;
    }

    public static AirConditioner install(UUID roomId, String name, String transmitterDeviceId) {
        return new AirConditioner(UUID.randomUUID(), roomId, name, transmitterDeviceId, true,
                AcStatus.OFF, Collections.emptyMap(), null);
    }

    public Optional<String> irCodeFor(IrCommandType commandType) {
        String code = irCodes.get(commandType);
        return code == null || code.isBlank() ? Optional.empty() : Optional.of(code);
    }

    public boolean isOn() {
        return status == AcStatus.ON;
    }

    public boolean hasTransmitter() {
        return transmitterDeviceId != null && !transmitterDeviceId.isBlank();
    }

    /**
     * Mirrors a status change that has already been persisted.
     */
    public void applyStatus(AcStatus status, Instant at) {
        this.status = status;
        this.lastCommand = at;
    }

    @Override
    public String toString() {
        return "AirConditioner{id=" + id + ", name=" + name + ", roomId=" + roomId + ", status=" + status + '}';
    }
}
