package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.infrastructure.persistence.entity.SensorEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA repository for SensorEntity.
 *
 * The liveness updates are conditional single statements; their row count tells the caller
 * whether the transition happened.
 */
@Repository
public interface SensorJpaRepository extends JpaRepository<SensorEntity, UUID> {

    Optional<SensorEntity> findByDeviceId(String deviceId);

    boolean existsByDeviceId(String deviceId);

    List<SensorEntity> findAllByOrderByNameAsc();

    List<SensorEntity> findByRoomIdOrderByNameAsc(UUID roomId);

    List<SensorEntity> findByOnlineTrueAndLastSeenBefore(Instant threshold);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SensorEntity s set s.lastSeen = :seenAt, s.updatedAt = :seenAt "
            + "where s.id = :id and s.online = true")
    int touchIfOnline(@Param("id") UUID id, @Param("seenAt") Instant seenAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SensorEntity s set s.online = true, s.lastSeen = :seenAt, s.updatedAt = :seenAt "
            + "where s.id = :id and s.online = false")
    int markOnlineIfOffline(@Param("id") UUID id, @Param("seenAt") Instant seenAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SensorEntity s set s.online = false, s.updatedAt = :now "
            + "where s.id = :id and s.online = true and s.lastSeen < :threshold")
    int markOfflineIfStale(@Param("id") UUID id, @Param("threshold") Instant threshold, @Param("now") Instant now);
}
