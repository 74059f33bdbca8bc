package com.koni.thermoguard.infrastructure.web.controller;

import com.koni.thermoguard.application.query.GetSensorsQuery;
import com.koni.thermoguard.application.query.GetSensorsQueryHandler;
import com.koni.thermoguard.application.query.SensorResponse;
import com.koni.thermoguard.application.service.SensorLivenessService;
import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.infrastructure.web.dto.RegisterSensorRequest;
import com.koni.thermoguard.infrastructure.web.security.Caller;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for sensors.
 *
 * Endpoints:
 * - GET /api/v1/sensors: every sensor with its latest reading, optionally filtered by room
 * - POST /api/v1/sensors: register a sensor
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SensorController {

    private final GetSensorsQueryHandler queryHandler;
    private final SensorLivenessService sensorLivenessService;

    /**
     * @return 200 OK with the sensors (empty list if none exist)
     */
    @GetMapping("/v1/sensors")
    public ResponseEntity<List<SensorResponse>> getSensors(@RequestParam(required = false) UUID roomId) {
        List<SensorResponse> sensors = queryHandler.handle(new GetSensorsQuery(roomId));
        log.debug("Returning {} sensors: roomId={}", sensors.size(), roomId);
        return ResponseEntity.ok(sensors);
    }

    @PostMapping("/v1/sensors")
    public ResponseEntity<SensorResponse> registerSensor(
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role,
            @RequestBody @Valid RegisterSensorRequest request) {
        Caller.fromHeaders(userId, role).requireDeviceControl();

        Sensor sensor = sensorLivenessService.registerSensor(
                request.getRoomId(), request.getDeviceId(), request.getName());
        SensorResponse body = new SensorResponse(sensor.getId(), sensor.getRoomId(), sensor.getDeviceId(),
                sensor.getName(), sensor.isOnline(), sensor.getLastSeen(), null, null, null);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }
}
