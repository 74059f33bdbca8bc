package com.koni.thermoguard.infrastructure.web.controller;

import com.koni.thermoguard.application.service.AirConditionerService;
import com.koni.thermoguard.application.service.CommandOutcome;
import com.koni.thermoguard.domain.model.Actor;
import com.koni.thermoguard.domain.model.IrSignal;
import com.koni.thermoguard.infrastructure.web.dto.CommandLogResponse;
import com.koni.thermoguard.infrastructure.web.dto.CommandResponse;
import com.koni.thermoguard.infrastructure.web.dto.IrRecordRequest;
import com.koni.thermoguard.infrastructure.web.dto.IrSignalRequest;
import com.koni.thermoguard.infrastructure.web.dto.IrSignalResponse;
import com.koni.thermoguard.infrastructure.web.exception.CommandFailedException;
import com.koni.thermoguard.infrastructure.web.security.Caller;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * REST controller for air conditioner actuation and IR learning.
 *
 * Every write endpoint requires an admin or operator; the check happens before the service is called.
 * A command that was not delivered answers 502 with code {@code command_failed}.
 */
@RestController
@RequestMapping("/api/v1/air-conditioners")
@RequiredArgsConstructor
@Slf4j
public class AirConditionerController {

    private final AirConditionerService airConditionerService;

    @PostMapping("/{airConditionerId}/turn-on")
    public ResponseEntity<CommandResponse> turnOn(
            @PathVariable UUID airConditionerId,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role) {
        return command(userId, role, actor -> airConditionerService.turnOn(airConditionerId, actor));
    }

    @PostMapping("/{airConditionerId}/turn-off")
    public ResponseEntity<CommandResponse> turnOff(
            @PathVariable UUID airConditionerId,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role) {
        return command(userId, role, actor -> airConditionerService.turnOff(airConditionerId, actor));
    }

    @PostMapping("/{airConditionerId}/toggle")
    public ResponseEntity<CommandResponse> toggle(
            @PathVariable UUID airConditionerId,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role) {
        return command(userId, role, actor -> airConditionerService.toggle(airConditionerId, actor));
    }

    /**
     * Turns off every running unit, in one room or everywhere. Answers 200 with per-unit outcomes.
     */
    @PostMapping("/turn-off-all")
    public ResponseEntity<List<CommandResponse>> turnOffAll(
            @RequestParam(required = false) UUID roomId,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role) {
        Actor actor = Caller.fromHeaders(userId, role).requireDeviceControl();
        List<CommandResponse> outcomes = airConditionerService.turnOffAll(roomId, actor).stream()
                .map(CommandResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(outcomes);
    }

    /**
     * Puts the paired transmitter in learning mode; the learned signal arrives later over Kafka.
     *
     * @return 202 Accepted when the transmitter was reached
     */
    @PostMapping("/{airConditionerId}/record-ir")
    public ResponseEntity<Void> startIrRecording(
            @PathVariable UUID airConditionerId,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role,
            @RequestBody @Valid IrRecordRequest request) {
        Caller.fromHeaders(userId, role).requireDeviceControl();
        if (!airConditionerService.startIrRecording(airConditionerId, request.getCommandType())) {
            throw new CommandFailedException("Could not start IR recording for " + request.getCommandType().code());
        }
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{airConditionerId}/ir-signals")
    public ResponseEntity<IrSignalResponse> recordIrSignal(
            @PathVariable UUID airConditionerId,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role,
            @RequestBody @Valid IrSignalRequest request) {
        Caller.fromHeaders(userId, role).requireDeviceControl();
        IrSignal signal = airConditionerService.recordIrSignal(airConditionerId, request.getCommandType(),
                request.getRawSignal(), request.getProtocol());
        return ResponseEntity.status(HttpStatus.CREATED).body(IrSignalResponse.from(signal));
    }

    @GetMapping("/{airConditionerId}/ir-signals")
    public ResponseEntity<List<IrSignalResponse>> getIrSignals(@PathVariable UUID airConditionerId) {
        List<IrSignalResponse> signals = airConditionerService.getIrSignals(airConditionerId).stream()
                .map(IrSignalResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(signals);
    }

    @GetMapping("/{airConditionerId}/logs")
    public ResponseEntity<List<CommandLogResponse>> getRecentCommands(@PathVariable UUID airConditionerId) {
        List<CommandLogResponse> logs = airConditionerService.getRecentCommands(airConditionerId).stream()
                .map(CommandLogResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(logs);
    }

    private ResponseEntity<CommandResponse> command(String userId, String role,
                                                    Function<Actor, CommandOutcome> action) {
        Actor actor = Caller.fromHeaders(userId, role).requireDeviceControl();
        CommandOutcome outcome = action.apply(actor);
        if (!outcome.isSuccess()) {
            throw new CommandFailedException(outcome.getMessage());
        }
        return ResponseEntity.ok(CommandResponse.from(outcome));
    }
}
