package com.koni.thermoguard.domain.repository;

import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for alerts.
 */
public interface AlertRepository {

    void save(Alert alert);

    Optional<Alert> findById(UUID alertId);

    /**
     * Whether an unacknowledged alert of the same room and type was created after {@code since}.
     */
    boolean existsUnacknowledgedSince(UUID roomId, AlertType type, Instant since);

    /**
     * Conditional update applied only while the alert is unacknowledged.
     *
     * @return true if this call acknowledged the alert
     */
    boolean acknowledge(UUID alertId, UUID userId, Instant acknowledgedAt);

    /**
     * Counts unacknowledged alerts; null arguments mean "any".
     */
    long countUnacknowledged(UUID roomId, AlertSeverity severity);

    /**
     * Unacknowledged alerts, newest first; null arguments mean "any".
     */
    List<Alert> findUnacknowledged(UUID roomId, AlertSeverity severity);

    List<Alert> findUnacknowledgedCreatedBefore(AlertSeverity severity, Instant before);

    int deleteAcknowledgedCreatedBefore(Instant before);
}
