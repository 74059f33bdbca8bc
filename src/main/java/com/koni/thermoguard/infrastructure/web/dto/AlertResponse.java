package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
@AllArgsConstructor
public class AlertResponse {

    private final UUID alertId;
    private final UUID roomId;
    private final AlertType type;
    private final AlertSeverity severity;
    private final String message;
    private final boolean acknowledged;
    private final UUID acknowledgedBy;
    private final Instant acknowledgedAt;
    private final Instant createdAt;

    public static AlertResponse from(Alert alert) {
        return new AlertResponse(
                alert.getId(),
                alert.getRoomId(),
                alert.getType(),
                alert.getSeverity(),
                alert.getMessage(),
                alert.isAcknowledged(),
                alert.getAcknowledgedBy(),
                alert.getAcknowledgedAt(),
                alert.getCreatedAt()
        );
    }
}
