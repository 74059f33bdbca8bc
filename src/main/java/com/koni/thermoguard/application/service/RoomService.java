package com.koni.thermoguard.application.service;

import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.model.OperationMode;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private final RoomRepository roomRepository;

    /**
     * Changes a room's setpoints or mode; null arguments keep the current value.
     * The next reading is evaluated against the new settings.
     */
    public Room updateSettings(UUID roomId, Double targetTemperature, Double targetHumidity,
                               OperationMode operationMode) {
        Room room = roomRepository.findById(roomId)
                .orElseThrow(() -> new NotFoundException("Room not found: " + roomId));
        Room updated = room.withSettings(targetTemperature, targetHumidity, operationMode);
        if (!roomRepository.updateSettings(updated)) {
            throw new NotFoundException("Room not found: " + roomId);
        }
        log.info("Room settings updated: roomId={}, targetTemperature={}, targetHumidity={}, mode={}",
                roomId, updated.getTargetTemperature(), updated.getTargetHumidity(),
                updated.getOperationMode().code());
        return updated;
    }
}
