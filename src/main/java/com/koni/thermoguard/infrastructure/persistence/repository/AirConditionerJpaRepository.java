package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.AcStatus;
import com.koni.thermoguard.infrastructure.persistence.entity.AirConditionerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AirConditionerJpaRepository extends JpaRepository<AirConditionerEntity, UUID> {

    List<AirConditionerEntity> findByRoomIdOrderByNameAsc(UUID roomId);

    Optional<AirConditionerEntity> findFirstByRoomIdAndActiveTrueAndStatusOrderByNameAsc(UUID roomId, AcStatus status);

    List<AirConditionerEntity> findByActiveTrueAndStatusOrderByNameAsc(AcStatus status);

    List<AirConditionerEntity> findByRoomIdAndActiveTrueAndStatusOrderByNameAsc(UUID roomId, AcStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update AirConditionerEntity a set a.status = :status, a.lastCommand = :lastCommand, "
            + "a.updatedAt = :lastCommand where a.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") AcStatus status,
                     @Param("lastCommand") Instant lastCommand);
}
