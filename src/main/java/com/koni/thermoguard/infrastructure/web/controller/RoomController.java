package com.koni.thermoguard.infrastructure.web.controller;

import com.koni.thermoguard.application.query.GetRoomAverageQueryHandler;
import com.koni.thermoguard.application.query.RoomAverageResponse;
import com.koni.thermoguard.application.service.RoomService;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.infrastructure.web.dto.RoomResponse;
import com.koni.thermoguard.infrastructure.web.dto.RoomSettingsRequest;
import com.koni.thermoguard.infrastructure.web.security.Caller;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RoomController {

    private final GetRoomAverageQueryHandler averageQueryHandler;
    private final RoomService roomService;

    @GetMapping("/v1/rooms/{roomId}/average")
    public ResponseEntity<RoomAverageResponse> getAverage(@PathVariable UUID roomId) {
        return ResponseEntity.ok(averageQueryHandler.handle(roomId));
    }

    /**
     * Changes setpoints or operation mode. Requires an admin or operator.
     */
    @PatchMapping("/v1/rooms/{roomId}/settings")
    public ResponseEntity<RoomResponse> updateSettings(
            @PathVariable UUID roomId,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role,
            @RequestBody RoomSettingsRequest request) {
        Caller.fromHeaders(userId, role).requireDeviceControl();

        Room room = roomService.updateSettings(roomId, request.getTargetTemperature(),
                request.getTargetHumidity(), request.getOperationMode());
        return ResponseEntity.ok(RoomResponse.from(room));
    }
}
