package com.koni.thermoguard.infrastructure.web.controller;

import com.koni.thermoguard.application.command.ReadingOutcome;
import com.koni.thermoguard.application.command.SubmitReadingCommand;
import com.koni.thermoguard.application.command.SubmitReadingCommandHandler;
import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.infrastructure.web.dto.BulkReadingRequest;
import com.koni.thermoguard.infrastructure.web.dto.BulkReadingResponse;
import com.koni.thermoguard.infrastructure.web.dto.ReadingRequest;
import com.koni.thermoguard.infrastructure.web.dto.ReadingResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for reading ingestion.
 *
 * Endpoints:
 * - POST /api/v1/readings: one reading, sensor identified in the body
 * - POST /api/v1/sensors/{sensorId}/readings: one reading, sensor identified in the path
 * - POST /api/v1/readings/bulk: several readings, each processed independently
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ReadingController {

    // null array entries are rejected per item by the handler's validation
    private static final SubmitReadingCommand EMPTY_ITEM = new SubmitReadingCommand(null, null, null, null);

    private final SubmitReadingCommandHandler commandHandler;

    /**
     * Example request:
     * POST /api/v1/readings
     * {
     *   "deviceId": "esp32-rack-a1",
     *   "temperature": 23.5,
     *   "humidity": 48.0
     * }
     *
     * @return 201 Created with the stored reading
     */
    @PostMapping("/v1/readings")
    public ResponseEntity<ReadingResponse> submitReading(@RequestBody ReadingRequest request) {
        log.debug("Received reading: identifier={}, temperature={}, humidity={}",
                request.identifier(), request.getTemperature(), request.getHumidity());
        Reading reading = commandHandler.handle(toCommand(request.identifier(), request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ReadingResponse.from(reading));
    }

    @PostMapping("/v1/sensors/{sensorId}/readings")
    public ResponseEntity<ReadingResponse> submitSensorReading(@PathVariable String sensorId,
                                                               @RequestBody ReadingRequest request) {
        Reading reading = commandHandler.handle(toCommand(sensorId, request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ReadingResponse.from(reading));
    }

    /**
     * Returns 200 OK with one outcome per item even when some items were rejected.
     */
    @PostMapping("/v1/readings/bulk")
    public ResponseEntity<BulkReadingResponse> submitBulk(@RequestBody @Valid BulkReadingRequest request) {
        log.info("Received bulk readings: count={}", request.getReadings().size());
        List<SubmitReadingCommand> commands = request.getReadings().stream()
                .map(item -> item == null ? EMPTY_ITEM : toCommand(item.identifier(), item))
                .collect(Collectors.toList());
        List<ReadingOutcome> outcomes = commandHandler.handleBulk(commands);
        return ResponseEntity.ok(BulkReadingResponse.of(outcomes));
    }

    private static SubmitReadingCommand toCommand(String identifier, ReadingRequest request) {
        return new SubmitReadingCommand(identifier, request.getTemperature(), request.getHumidity(),
                request.getTimestamp());
    }
}
