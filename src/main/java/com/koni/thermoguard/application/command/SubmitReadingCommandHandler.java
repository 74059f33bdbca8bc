package com.koni.thermoguard.application.command;

import com.koni.thermoguard.application.port.NotificationPublisher;
import com.koni.thermoguard.application.service.AirConditionerService;
import com.koni.thermoguard.application.service.AlertService;
import com.koni.thermoguard.application.service.SensorLivenessService;
import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.domain.repository.ReadingRepository;
import com.koni.thermoguard.domain.repository.RoomRepository;
import com.koni.thermoguard.domain.repository.SensorRepository;
import com.koni.thermoguard.infrastructure.observability.ThermoGuardMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Command handler for ingesting sensor readings.
 *
 * Responsibilities:
 * - Validate the measured values and resolve the reporting sensor
 * - Mark the sensor online and persist the reading
 * - Then, in this order: evaluate alert rules, apply automatic control, broadcast the reading
 *
 * Only validation and sensor resolution errors reach the caller. The three steps after persistence
 * are independent side effects: a failure in one is logged and counted, and the next still runs.
 * No transaction spans the pipeline, so a persisted reading is never rolled back by them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmitReadingCommandHandler {

    private final SensorRepository sensorRepository;
    private final RoomRepository roomRepository;
    private final ReadingRepository readingRepository;
    private final SensorLivenessService sensorLivenessService;
    private final AlertService alertService;
    private final AirConditionerService airConditionerService;
    private final NotificationPublisher notificationPublisher;
    private final ThermoGuardMetrics metrics;

    /**
     * Ingests one reading.
     *
     * @param command the reading to ingest
     * @return the persisted reading
     * @throws ValidationException if no value is present or a value is out of range
     * @throws NotFoundException if no sensor matches the identifier
     */
    @Observed(name = "command.handler", contextualName = "submit-reading")
    public Reading handle(SubmitReadingCommand command) {
        log.debug("Handling SubmitReadingCommand: identifier={}, temperature={}, humidity={}",
                command.getIdentifier(), command.getTemperature(), command.getHumidity());
        return metrics.recordPipelineTime(() -> process(command));
    }

    /**
     * Ingests readings in list order. Each item succeeds or fails on its own.
     */
    @Observed(name = "command.handler", contextualName = "submit-readings-bulk")
    public List<ReadingOutcome> handleBulk(List<SubmitReadingCommand> commands) {
        List<ReadingOutcome> outcomes = new ArrayList<>(commands.size());
        for (int index = 0; index < commands.size(); index++) {
            outcomes.add(handleItem(index, commands.get(index)));
        }
        log.info("Bulk readings processed: total={}, accepted={}", outcomes.size(),
                outcomes.stream().filter(ReadingOutcome::isAccepted).count());
        return outcomes;
    }

    private ReadingOutcome handleItem(int index, SubmitReadingCommand command) {
        try {
            return ReadingOutcome.accepted(index, handle(command).getId());
        } catch (ValidationException e) {
            return ReadingOutcome.rejected(index, "validation_error", e.getMessage());
        } catch (NotFoundException e) {
            return ReadingOutcome.rejected(index, "not_found", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Bulk reading failed: index={}, identifier={}", index, command.getIdentifier(), e);
            return ReadingOutcome.rejected(index, "server_error", "Reading could not be stored");
        }
    }

    private Reading process(SubmitReadingCommand command) {
        metrics.recordReadingReceived();

        Sensor sensor;
        try {
            Reading.validateValues(command.getTemperature(), command.getHumidity());
            sensor = resolveSensor(command.getIdentifier());
        } catch (ValidationException | NotFoundException e) {
            metrics.recordReadingRejected();
            log.info("Reading rejected: identifier={}, reason={}", command.getIdentifier(), e.getMessage());
            throw e;
        }
        Room room = roomRepository.findById(sensor.getRoomId())
                .orElseThrow(() -> new NotFoundException("Room not found: " + sensor.getRoomId()));

        sensorLivenessService.markOnline(sensor);
        Reading reading = Reading.create(sensor.getId(), command.getTemperature(), command.getHumidity(),
                command.getTimestamp());
        readingRepository.save(reading);
        log.info("Reading saved: sensorId={}, deviceId={}, temperature={}, humidity={}",
                sensor.getId(), sensor.getDeviceId(), reading.getTemperature(), reading.getHumidity());

        evaluateAlerts(room, reading);
        applyAutomaticControl(room, reading);
        broadcast(sensor, reading);
        return reading;
    }

    private Sensor resolveSensor(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new ValidationException("deviceId or sensorId is required");
        }
        Optional<Sensor> byDeviceId = sensorRepository.findByDeviceId(identifier);
        if (byDeviceId.isPresent()) {
            return byDeviceId.get();
        }
        return parseUuid(identifier)
                .flatMap(sensorRepository::findById)
                .orElseThrow(() -> new NotFoundException("Sensor not found: " + identifier));
    }

    private static Optional<UUID> parseUuid(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private void evaluateAlerts(Room room, Reading reading) {
        try {
            alertService.evaluateReading(room, reading);
        } catch (RuntimeException e) {
            metrics.recordStepFailure("alert-evaluation");
            log.warn("Alert evaluation failed: readingId={}, roomId={}", reading.getId(), room.getId(), e);
        }
    }

    private void applyAutomaticControl(Room room, Reading reading) {
        if (!room.isAutomatic() || !reading.hasTemperature()) {
            return;
        }
        try {
            airConditionerService.applyHysteresis(room, reading.getTemperature());
        } catch (RuntimeException e) {
            metrics.recordStepFailure("automatic-control");
            log.warn("Automatic control failed: readingId={}, roomId={}", reading.getId(), room.getId(), e);
        }
    }

    private void broadcast(Sensor sensor, Reading reading) {
        try {
            notificationPublisher.publish(NotificationEvent.sensorReading(sensor, reading));
        } catch (RuntimeException e) {
            metrics.recordStepFailure("broadcast");
            log.warn("Reading broadcast failed: readingId={}", reading.getId(), e);
        }
    }
}
