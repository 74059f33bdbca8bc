package com.koni.thermoguard.application.service;

import com.koni.thermoguard.application.port.NotificationPublisher;
import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.domain.exception.DuplicateSensorException;
import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.domain.repository.RoomRepository;
import com.koni.thermoguard.domain.repository.SensorRepository;
import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import com.koni.thermoguard.infrastructure.observability.ThermoGuardMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Device registry: sensor registration and the online/offline state machine.
 *
 * A sensor goes online only through a reading and offline only through the sweep.
 * Both transitions are single conditional updates of the liveness columns, so a reading racing
 * the sweep never produces a spurious offline alert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SensorLivenessService {

    private final SensorRepository sensorRepository;
    private final RoomRepository roomRepository;
    private final AlertService alertService;
    private final NotificationPublisher notificationPublisher;
    private final ThermoGuardMetrics metrics;
    private final ThermoGuardProperties properties;

    /**
     * @throws NotFoundException if the room does not exist
     * @throws DuplicateSensorException if the device id is already registered
     */
    public Sensor registerSensor(UUID roomId, String deviceId, String name) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new ValidationException("deviceId is required");
        }
        if (!roomRepository.existsById(roomId)) {
            throw new NotFoundException("Room not found: " + roomId);
        }
        if (sensorRepository.existsByDeviceId(deviceId)) {
            throw new DuplicateSensorException(deviceId);
        }

        Sensor sensor = Sensor.register(roomId, deviceId, name != null && !name.isBlank() ? name : deviceId);
        sensorRepository.save(sensor);
        log.info("Sensor registered: sensorId={}, deviceId={}, roomId={}", sensor.getId(), deviceId, roomId);
        return sensor;
    }

    /**
     * Records contact from the sensor and broadcasts the transition if it was offline.
     *
     * @return true if the sensor came back online
     */
    public boolean markOnline(Sensor sensor) {
        boolean cameOnline = sensorRepository.markOnline(sensor.getId(), Instant.now());
        if (cameOnline) {
            log.info("Sensor online: sensorId={}, deviceId={}", sensor.getId(), sensor.getDeviceId());
            publishQuietly(NotificationEvent.connectionStatus(sensor, true));
        }
        return cameOnline;
    }

    /**
     * Marks stale online sensors offline. Only the call that wins the online-to-offline transition
     * raises the sensor_offline alert and the broadcast, so repeated sweeps are idempotent.
     */
    public SweepResult checkAllSensorStatus() {
        Instant threshold = Instant.now().minus(properties.getSensors().getOfflineThreshold());
        List<Sensor> stale = sensorRepository.findOnlineNotSeenSince(threshold);

        int markedOffline = 0;
        int failed = 0;
        for (Sensor sensor : stale) {
            try {
                if (sensorRepository.markOffline(sensor.getId(), threshold)) {
                    markedOffline++;
                    handleWentOffline(sensor);
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to update sensor status: sensorId={}", sensor.getId(), e);
            }
        }

        if (!stale.isEmpty()) {
            log.info("Sensor status check: checked={}, markedOffline={}, failed={}",
                    stale.size(), markedOffline, failed);
        }
        return new SweepResult(stale.size(), markedOffline, failed);
    }

    private void handleWentOffline(Sensor sensor) {
        log.warn("Sensor offline: sensorId={}, deviceId={}, lastSeen={}",
                sensor.getId(), sensor.getDeviceId(), sensor.getLastSeen());
        metrics.recordSensorMarkedOffline();
        raiseOfflineAlert(sensor);
        publishQuietly(NotificationEvent.connectionStatus(sensor, false));
    }

    private void raiseOfflineAlert(Sensor sensor) {
        try {
            alertService.createAlert(sensor.getRoomId(), AlertType.SENSOR_OFFLINE, AlertSeverity.WARNING,
                    "Sensor " + sensor.getName() + " is offline");
        } catch (RuntimeException e) {
            log.error("Failed to raise sensor_offline alert: sensorId={}", sensor.getId(), e);
        }
    }

    private void publishQuietly(NotificationEvent event) {
        try {
            notificationPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish connection status: eventId={}", event.getEventId(), e);
        }
    }
}
