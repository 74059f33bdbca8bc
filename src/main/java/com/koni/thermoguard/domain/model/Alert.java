package com.koni.thermoguard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * A raised condition for a room. Once acknowledged it stays acknowledged.
 */
@Getter
@AllArgsConstructor
public class Alert {

    private final UUID id;
    private final UUID roomId;
    private final AlertType type;
    private final AlertSeverity severity;
    private final String message;
    private boolean acknowledged;
    private UUID acknowledgedBy;
    private Instant acknowledgedAt;
    private final Instant createdAt;

    public static Alert raise(UUID roomId, AlertType type, AlertSeverity severity, String message) {
        return new Alert(UUID.randomUUID(), roomId, type, severity, message, false, null, null, Instant.now());
    }

    /**
     * Mirrors an acknowledgement that has already been persisted.
     */
    public void markAcknowledged(UUID userId, Instant at) {
        this.acknowledged = true;
        this.acknowledgedBy = userId;
        this.acknowledgedAt = at;
    }

    @Override
    public String toString() {
        return "Alert{id=" + id + ", roomId=" + roomId + ", type=" + type + ", severity=" + severity
                + ", acknowledged=" + acknowledged + '}';
    }
}
