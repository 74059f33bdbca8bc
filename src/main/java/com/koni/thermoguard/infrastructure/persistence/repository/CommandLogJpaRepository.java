package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.infrastructure.persistence.entity.CommandLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface CommandLogJpaRepository extends JpaRepository<CommandLogEntity, UUID> {

    List<CommandLogEntity> findByAirConditionerIdOrderByCreatedAtDesc(UUID airConditionerId, Pageable pageable);

    long countByAirConditionerId(UUID airConditionerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from CommandLogEntity c where c.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
