package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.infrastructure.persistence.entity.AlertEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA repository for AlertEntity.
 */
@Repository
public interface AlertJpaRepository extends JpaRepository<AlertEntity, UUID> {

    boolean existsByRoomIdAndAlertTypeAndAcknowledgedFalseAndCreatedAtAfter(
            UUID roomId, AlertType alertType, Instant since);

    /**
     * Acknowledges the alert only if nobody did before; returns the number of rows changed.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update AlertEntity a set a.acknowledged = true, a.acknowledgedBy = :userId, "
            + "a.acknowledgedAt = :acknowledgedAt, a.updatedAt = :acknowledgedAt "
            + "where a.id = :id and a.acknowledged = false")
    int acknowledgeIfOpen(@Param("id") UUID id, @Param("userId") UUID userId,
                          @Param("acknowledgedAt") Instant acknowledgedAt);

    long countByAcknowledgedFalse();

    long countByAcknowledgedFalseAndRoomId(UUID roomId);

    long countByAcknowledgedFalseAndSeverity(AlertSeverity severity);

    long countByAcknowledgedFalseAndRoomIdAndSeverity(UUID roomId, AlertSeverity severity);

    List<AlertEntity> findByAcknowledgedFalseOrderByCreatedAtDesc();

    List<AlertEntity> findByAcknowledgedFalseAndRoomIdOrderByCreatedAtDesc(UUID roomId);

    List<AlertEntity> findByAcknowledgedFalseAndSeverityOrderByCreatedAtDesc(AlertSeverity severity);

    List<AlertEntity> findByAcknowledgedFalseAndRoomIdAndSeverityOrderByCreatedAtDesc(
            UUID roomId, AlertSeverity severity);

    List<AlertEntity> findBySeverityAndAcknowledgedFalseAndCreatedAtBeforeOrderByCreatedAtAsc(
            AlertSeverity severity, Instant before);

    long countByRoomId(UUID roomId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from AlertEntity a where a.acknowledged = true and a.createdAt < :before")
    int deleteAcknowledgedCreatedBefore(@Param("before") Instant before);
}
