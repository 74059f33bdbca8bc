package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.OperationMode;
import com.koni.thermoguard.infrastructure.persistence.entity.RoomEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface RoomJpaRepository extends JpaRepository<RoomEntity, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update RoomEntity r set r.targetTemperature = :targetTemperature, "
            + "r.targetHumidity = :targetHumidity, r.operationMode = :operationMode, r.updatedAt = :now "
            + "where r.id = :id")
    int updateSettings(@Param("id") UUID id,
                       @Param("targetTemperature") double targetTemperature,
                       @Param("targetHumidity") double targetHumidity,
                       @Param("operationMode") OperationMode operationMode,
                       @Param("now") Instant now);
}
