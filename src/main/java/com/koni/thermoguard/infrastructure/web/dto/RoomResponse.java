package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.domain.model.OperationMode;
import com.koni.thermoguard.domain.model.Room;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

@Getter
@AllArgsConstructor
public class RoomResponse {

    private final UUID roomId;
    private final String name;
    private final double targetTemperature;
    private final double targetHumidity;
    private final OperationMode operationMode;

    public static RoomResponse from(Room room) {
        return new RoomResponse(room.getId(), room.getName(), room.getTargetTemperature(),
                room.getTargetHumidity(), room.getOperationMode());
    }
}
