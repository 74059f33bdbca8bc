package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.repository.AlertRepository;
import com.koni.thermoguard.infrastructure.persistence.entity.AlertEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for AlertRepository.
 *
 * Acknowledgement is a conditional update on {@code is_acknowledged = false}, so two
 * concurrent acknowledgements of the same alert cannot both succeed.
 */
@Component
@RequiredArgsConstructor
public class JpaAlertRepositoryAdapter implements AlertRepository {

    private final AlertJpaRepository jpaRepository;
    private final RoomJpaRepository roomJpaRepository;

    @Override
    public void save(Alert alert) {
        if (alert == null) {
            throw new IllegalArgumentException("Alert cannot be null");
        }
        AlertEntity entity = new AlertEntity();
        entity.setId(alert.getId());
        entity.setRoom(roomJpaRepository.getReferenceById(alert.getRoomId()));
        entity.setRoomId(alert.getRoomId());
        entity.setAlertType(alert.getType());
        entity.setSeverity(alert.getSeverity());
        entity.setMessage(alert.getMessage());
        entity.setAcknowledged(alert.isAcknowledged());
        entity.setAcknowledgedBy(alert.getAcknowledgedBy());
        entity.setAcknowledgedAt(alert.getAcknowledgedAt());
        entity.setCreatedAt(alert.getCreatedAt());
        jpaRepository.save(entity);
    }

    @Override
    public Optional<Alert> findById(UUID alertId) {
        if (alertId == null) {
            throw new IllegalArgumentException("AlertId cannot be null");
        }
        return jpaRepository.findById(alertId).map(this::toDomain);
    }

    @Override
    public boolean existsUnacknowledgedSince(UUID roomId, AlertType type, Instant since) {
        return jpaRepository.existsByRoomIdAndAlertTypeAndAcknowledgedFalseAndCreatedAtAfter(roomId, type, since);
    }

    @Override
    @Transactional
    public boolean acknowledge(UUID alertId, UUID userId, Instant acknowledgedAt) {
        return jpaRepository.acknowledgeIfOpen(alertId, userId, acknowledgedAt) == 1;
    }

    @Override
    public long countUnacknowledged(UUID roomId, AlertSeverity severity) {
        if (roomId == null && severity == null) {
            return jpaRepository.countByAcknowledgedFalse();
        }
        if (severity == null) {
            return jpaRepository.countByAcknowledgedFalseAndRoomId(roomId);
        }
        if (roomId == null) {
            return jpaRepository.countByAcknowledgedFalseAndSeverity(severity);
        }
        return jpaRepository.countByAcknowledgedFalseAndRoomIdAndSeverity(roomId, severity);
    }

    @Override
    public List<Alert> findUnacknowledged(UUID roomId, AlertSeverity severity) {
        List<AlertEntity> entities;
        if (roomId == null && severity == null) {
            entities = jpaRepository.findByAcknowledgedFalseOrderByCreatedAtDesc();
        } else if (severity == null) {
            entities = jpaRepository.findByAcknowledgedFalseAndRoomIdOrderByCreatedAtDesc(roomId);
        } else if (roomId == null) {
            entities = jpaRepository.findByAcknowledgedFalseAndSeverityOrderByCreatedAtDesc(severity);
        } else {
            entities = jpaRepository.findByAcknowledgedFalseAndRoomIdAndSeverityOrderByCreatedAtDesc(roomId, severity);
        }
        return entities.stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public List<Alert> findUnacknowledgedCreatedBefore(AlertSeverity severity, Instant before) {
        return jpaRepository.findBySeverityAndAcknowledgedFalseAndCreatedAtBeforeOrderByCreatedAtAsc(severity, before)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public int deleteAcknowledgedCreatedBefore(Instant before) {
        return jpaRepository.deleteAcknowledgedCreatedBefore(before);
    }

    private Alert toDomain(AlertEntity entity) {
        return new Alert(
                entity.getId(),
                entity.getRoomId(),
                entity.getAlertType(),
                entity.getSeverity(),
                entity.getMessage(),
                entity.isAcknowledged(),
                entity.getAcknowledgedBy(),
                entity.getAcknowledgedAt(),
                entity.getCreatedAt()
        );
    }
}
