package com.koni.thermoguard.application.service;

import com.koni.thermoguard.application.port.NotificationPublisher;
import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.domain.exception.AlreadyAcknowledgedException;
import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.AlertCounts;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.repository.AlertRepository;
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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Alert engine.
 *
 * Responsibilities:
 * - Turn threshold breaches into alerts, suppressing repeats within the cooldown window
 * - Broadcast every created alert
 * - Acknowledge alerts exactly once
 * - Summarize, escalate and prune alerts for housekeeping
 *
 * The cooldown check and the insert run under a per (room, type) lock held by this instance.
 * Each repository call commits on its own, so the inserted row is visible to the next holder
 * of the lock. Across several application instances a rare duplicate is possible and accepted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private final AlertRepository alertRepository;
    private final ThresholdPolicy thresholdPolicy;
    private final NotificationPublisher notificationPublisher;
    private final ThermoGuardMetrics metrics;
    private final ThermoGuardProperties properties;

    private final ConcurrentMap<String, ReentrantLock> cooldownLocks = new ConcurrentHashMap<>();

    /**
     * Creates an alert unless an unacknowledged one of the same room and type is still within the cooldown.
     *
     * @return the created alert, or empty if it was suppressed
     */
    public Optional<Alert> createAlert(UUID roomId, AlertType type, AlertSeverity severity, String message) {
        if (roomId == null || type == null || severity == null) {
            throw new IllegalArgumentException("roomId, type and severity are required");
        }

        Alert alert;
        ReentrantLock lock = cooldownLocks.computeIfAbsent(roomId + ":" + type.code(), key -> new ReentrantLock());
        lock.lock();
        try {
            Instant since = Instant.now().minus(properties.getAlerts().getCooldown());
            if (alertRepository.existsUnacknowledgedSince(roomId, type, since)) {
                log.debug("Alert suppressed by cooldown: roomId={}, type={}", roomId, type.code());
                metrics.recordAlertSuppressed();
                return Optional.empty();
            }
            alert = Alert.raise(roomId, type, severity, message);
            alertRepository.save(alert);
        } finally {
            lock.unlock();
        }

        log.info("Alert created: alertId={}, roomId={}, type={}, severity={}, message={}",
                alert.getId(), roomId, type.code(), severity.code(), message);
        metrics.recordAlertCreated(severity);
        try {
            notificationPublisher.publish(NotificationEvent.alertTriggered(alert));
        } catch (RuntimeException e) {
            log.warn("Failed to publish alert: alertId={}", alert.getId(), e);
        }
        return Optional.of(alert);
    }

    /**
     * Raises the alerts a reading calls for.
     *
     * @return the alerts actually created, after cooldown suppression
     */
    public List<Alert> evaluateReading(Room room, Reading reading) {
        List<Alert> created = new ArrayList<>(2);
        for (ThresholdBreach breach : thresholdPolicy.evaluate(room, reading)) {
            createAlert(room.getId(), breach.getType(), breach.getSeverity(), breach.getMessage())
                    .ifPresent(created::add);
        }
        return created;
    }

    /**
     * Acknowledges an alert on behalf of a user.
     *
     * @throws NotFoundException if the alert does not exist
     * @throws AlreadyAcknowledgedException if it was acknowledged before, by this or a concurrent call
     */
    public Alert acknowledge(UUID alertId, UUID userId) {
        Alert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));
        if (alert.isAcknowledged()) {
            throw new AlreadyAcknowledgedException(alertId);
        }

        Instant now = Instant.now();
        if (!alertRepository.acknowledge(alertId, userId, now)) {
            throw new AlreadyAcknowledgedException(alertId);
        }
        alert.markAcknowledged(userId, now);
        log.info("Alert acknowledged: alertId={}, userId={}", alertId, userId);
        return alert;
    }

    public AlertCounts getActiveAlertsCount(UUID roomId) {
        return new AlertCounts(
                alertRepository.countUnacknowledged(roomId, null),
                alertRepository.countUnacknowledged(roomId, AlertSeverity.CRITICAL),
                alertRepository.countUnacknowledged(roomId, AlertSeverity.WARNING),
                alertRepository.countUnacknowledged(roomId, AlertSeverity.INFO)
        );
    }

    public List<Alert> getActiveAlerts(UUID roomId, AlertSeverity severity) {
        return alertRepository.findUnacknowledged(roomId, severity);
    }

    /**
     * Reports every critical alert left unacknowledged past the escalation age.
     * Alerts are not modified, so the same alert is reported again on the next run.
     *
     * @return number of alerts reported
     */
    public int escalateCriticalAlerts() {
        Instant before = Instant.now().minus(properties.getAlerts().getEscalationAge());
        List<Alert> unattended = alertRepository.findUnacknowledgedCreatedBefore(AlertSeverity.CRITICAL, before);
        for (Alert alert : unattended) {
            log.warn("ESCALATION: critical alert unacknowledged since {}: alertId={}, roomId={}, message={}",
                    alert.getCreatedAt(), alert.getId(), alert.getRoomId(), alert.getMessage());
            metrics.recordAlertEscalated();
        }
        return unattended.size();
    }

    /**
     * Deletes acknowledged alerts older than the retention window.
     *
     * @return number of alerts deleted
     */
    public int cleanupOldAlerts() {
        Instant cutoff = Instant.now().minus(properties.getAlerts().getRetention());
        int deleted = alertRepository.deleteAcknowledgedCreatedBefore(cutoff);
        log.info("Old alerts cleaned up: deleted={}, cutoff={}", deleted, cutoff);
        return deleted;
    }
}
