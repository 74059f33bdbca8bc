package com.koni.thermoguard.application.service;

import com.koni.thermoguard.application.port.IrTransmitter;
import com.koni.thermoguard.application.port.NotificationPublisher;
import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.domain.model.AcStatus;
import com.koni.thermoguard.domain.model.Actor;
import com.koni.thermoguard.domain.model.AirConditioner;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.model.CommandLog;
import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.domain.model.IrSignal;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.repository.AirConditionerRepository;
import com.koni.thermoguard.domain.repository.CommandLogRepository;
import com.koni.thermoguard.domain.repository.IrSignalRepository;
import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import com.koni.thermoguard.infrastructure.observability.ThermoGuardMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Actuation controller for infrared air conditioners.
 *
 * Responsibilities:
 * - Send power commands through the IR transmitter port
 * - Append a CommandLog entry for every attempt, before any status change
 * - Update status and broadcast only when the command succeeded
 * - Raise an ac_error alert when it did not
 * - Drive automatic rooms with a hysteresis band around the setpoint
 * - Store learned IR signals
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AirConditionerService {

    private static final int RECENT_LOG_LIMIT = 50;

    private final AirConditionerRepository airConditionerRepository;
    private final CommandLogRepository commandLogRepository;
    private final IrSignalRepository irSignalRepository;
    private final IrTransmitter irTransmitter;
    private final AlertService alertService;
    private final NotificationPublisher notificationPublisher;
    private final ThermoGuardMetrics metrics;
    private final ThermoGuardProperties properties;

    public CommandOutcome turnOn(UUID airConditionerId, Actor actor) {
        return turnOn(findAirConditioner(airConditionerId), actor);
    }

    public CommandOutcome turnOff(UUID airConditionerId, Actor actor) {
        return turnOff(findAirConditioner(airConditionerId), actor);
    }

    public CommandOutcome turnOn(AirConditioner airConditioner, Actor actor) {
        return execute(airConditioner, IrCommandType.POWER_ON, AcStatus.ON, actor);
    }

    public CommandOutcome turnOff(AirConditioner airConditioner, Actor actor) {
        return execute(airConditioner, IrCommandType.POWER_OFF, AcStatus.OFF, actor);
    }

    /**
     * Turns the unit off when it is on, and on otherwise.
     */
    public CommandOutcome toggle(UUID airConditionerId, Actor actor) {
        AirConditioner airConditioner = findAirConditioner(airConditionerId);
        return airConditioner.isOn() ? turnOff(airConditioner, actor) : turnOn(airConditioner, actor);
    }

    /**
     * Turns off every active unit that is on, in one room or everywhere when {@code roomId} is null.
     * One unit failing does not stop the others.
     */
    public List<CommandOutcome> turnOffAll(UUID roomId, Actor actor) {
        List<CommandOutcome> outcomes = new ArrayList<>();
        for (AirConditioner airConditioner : airConditionerRepository.findActiveByStatus(roomId, AcStatus.ON)) {
            outcomes.add(turnOff(airConditioner, actor));
        }
        log.info("Turn off all: roomId={}, units={}, actor={}", roomId, outcomes.size(), actor.describe());
        return outcomes;
    }

    /**
     * Turns on the first active unit of the room that is off.
     *
     * @return false if there is no such unit or the command failed
     */
    public boolean autoTurnOnAc(Room room) {
        Optional<AirConditioner> candidate =
                airConditionerRepository.findFirstActiveByRoomIdAndStatus(room.getId(), AcStatus.OFF);
        if (candidate.isEmpty()) {
            log.debug("No air conditioner to turn on: roomId={}", room.getId());
            return false;
        }
        return turnOn(candidate.get(), Actor.system()).isSuccess();
    }

    /**
     * Turns off the first active unit of the room that is on.
     *
     * @return false if there is no such unit or the command failed
     */
    public boolean autoTurnOffAc(Room room) {
        Optional<AirConditioner> candidate =
                airConditionerRepository.findFirstActiveByRoomIdAndStatus(room.getId(), AcStatus.ON);
        if (candidate.isEmpty()) {
            log.debug("No air conditioner to turn off: roomId={}", room.getId());
            return false;
        }
        return turnOff(candidate.get(), Actor.system()).isSuccess();
    }

    /**
     * Applies the hysteresis band around the room's target temperature.
     *
     * @return the decision taken; {@link ControlAction#HOLD} inside the band
     */
    public ControlAction applyHysteresis(Room room, double temperature) {
        double hysteresis = properties.getControl().getHysteresis();
        double target = room.getTargetTemperature();

        if (temperature > target + hysteresis) {
            autoTurnOnAc(room);
            return ControlAction.TURN_ON;
        }
        if (temperature < target - hysteresis) {
            autoTurnOffAc(room);
            return ControlAction.TURN_OFF;
        }
        return ControlAction.HOLD;
    }

    /**
     * Replays the learned code for a command.
     *
     * @return true if the command is considered delivered
     */
    public boolean sendCommand(AirConditioner airConditioner, IrCommandType commandType) {
        Optional<String> irCode = airConditioner.irCodeFor(commandType);
        if (irCode.isEmpty()) {
            if (properties.getControl().isSimulateMissingIrCodes()) {
                log.warn("No IR code recorded, treating command as sent: acId={}, command={}",
                        airConditioner.getId(), commandType.code());
                return true;
            }
            log.warn("No IR code recorded, command not sent: acId={}, command={}",
                    airConditioner.getId(), commandType.code());
            return false;
        }
        if (!airConditioner.hasTransmitter()) {
            log.warn("Air conditioner has no paired transmitter: acId={}", airConditioner.getId());
            return false;
        }

        try {
            return irTransmitter.send(airConditioner.getTransmitterDeviceId(), commandType, irCode.get());
        } catch (RuntimeException e) {
            log.error("IR transmitter failed: acId={}, command={}", airConditioner.getId(), commandType.code(), e);
            return false;
        }
    }

    /**
     * Asks the paired transmitter to learn the signal for a command.
     *
     * @throws NotFoundException if the air conditioner does not exist
     */
    public boolean startIrRecording(UUID airConditionerId, IrCommandType commandType) {
        AirConditioner airConditioner = findAirConditioner(airConditionerId);
        if (!airConditioner.hasTransmitter()) {
            log.warn("Cannot record IR signal, no paired transmitter: acId={}", airConditionerId);
            return false;
        }

        boolean started;
        try {
            started = irTransmitter.enterRecordingMode(
                    airConditioner.getTransmitterDeviceId(), airConditionerId, commandType);
        } catch (RuntimeException e) {
            log.error("Failed to start IR recording: acId={}, command={}", airConditionerId, commandType.code(), e);
            started = false;
        }
        log.info("IR recording requested: acId={}, command={}, started={}",
                airConditionerId, commandType.code(), started);
        return started;
    }

    /**
     * Stores a learned signal and makes it the unit's code for that command.
     *
     * @throws ValidationException if the signal is blank
     * @throws NotFoundException if the air conditioner does not exist
     */
    public IrSignal recordIrSignal(UUID airConditionerId, IrCommandType commandType, String rawSignal,
                                   String protocol) {
        if (airConditionerId == null) {
            throw new ValidationException("airConditionerId is required");
        }
        if (commandType == null) {
            throw new ValidationException("commandType is required");
        }
        if (rawSignal == null || rawSignal.isBlank()) {
            throw new ValidationException("rawSignal is required");
        }
        findAirConditioner(airConditionerId);

        IrSignal stored = irSignalRepository.upsert(
                IrSignal.learned(airConditionerId, commandType, rawSignal, protocol));
        airConditionerRepository.putIrCode(airConditionerId, commandType, rawSignal);
        log.info("IR signal recorded: acId={}, command={}, protocol={}", airConditionerId, commandType.code(), protocol);
        return stored;
    }

    public List<IrSignal> getIrSignals(UUID airConditionerId) {
        findAirConditioner(airConditionerId);
        return irSignalRepository.findByAirConditionerId(airConditionerId);
    }

    public List<CommandLog> getRecentCommands(UUID airConditionerId) {
        findAirConditioner(airConditionerId);
        return commandLogRepository.findRecentByAirConditionerId(airConditionerId, RECENT_LOG_LIMIT);
    }

    private CommandOutcome execute(AirConditioner airConditioner, IrCommandType command, AcStatus target,
                                   Actor actor) {
        boolean success = sendCommand(airConditioner, command);

        commandLogRepository.save(CommandLog.record(airConditioner.getId(), command, actor, success));
        metrics.recordCommand(success);

        if (!success) {
            log.error("Command failed: acId={}, name={}, command={}, actor={}",
                    airConditioner.getId(), airConditioner.getName(), command.code(), actor.describe());
            raiseCommandFailure(airConditioner, command);
            return new CommandOutcome(airConditioner.getId(), false,
                    "Failed to send " + command.code() + " to " + airConditioner.getName(),
                    airConditioner.getStatus());
        }

        Instant now = Instant.now();
        airConditionerRepository.updateStatus(airConditioner.getId(), target, now);
        airConditioner.applyStatus(target, now);
        log.info("Air conditioner turned {}: acId={}, name={}, actor={}",
                target.code(), airConditioner.getId(), airConditioner.getName(), actor.describe());

        try {
            notificationPublisher.publish(NotificationEvent.acStatusChanged(airConditioner, actor));
        } catch (RuntimeException e) {
            log.warn("Failed to publish status change: acId={}", airConditioner.getId(), e);
        }
        return new CommandOutcome(airConditioner.getId(), true,
                airConditioner.getName() + " turned " + target.code(), target);
    }

    private void raiseCommandFailure(AirConditioner airConditioner, IrCommandType command) {
        try {
            alertService.createAlert(airConditioner.getRoomId(), AlertType.AC_ERROR, AlertSeverity.WARNING,
                    "Failed to execute " + command.code() + " on " + airConditioner.getName());
        } catch (RuntimeException e) {
            log.error("Failed to raise ac_error alert: acId={}", airConditioner.getId(), e);
        }
    }

    private AirConditioner findAirConditioner(UUID airConditionerId) {
        return airConditionerRepository.findById(airConditionerId)
                .orElseThrow(() -> new NotFoundException("Air conditioner not found: " + airConditionerId));
    }
}
