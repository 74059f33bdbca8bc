package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.infrastructure.persistence.entity.ReadingEntity;
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
public interface ReadingJpaRepository extends JpaRepository<ReadingEntity, UUID> {

    Optional<ReadingEntity> findFirstBySensorIdOrderByTimestampDesc(UUID sensorId);

    List<ReadingEntity> findBySensorIdAndTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAsc(
            UUID sensorId, Instant from, Instant to);

    List<ReadingEntity> findBySensorIdAndTimestampBeforeOrderByTimestampAsc(UUID sensorId, Instant cutoff);

    long countBySensorId(UUID sensorId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ReadingEntity r where r.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ReadingEntity r where r.sensorId = :sensorId and r.timestamp < :cutoff")
    int deleteBySensorIdOlderThan(@Param("sensorId") UUID sensorId, @Param("cutoff") Instant cutoff);
}
