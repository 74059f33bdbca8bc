package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.infrastructure.persistence.entity.AggregatedReadingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AggregatedReadingJpaRepository extends JpaRepository<AggregatedReadingEntity, UUID> {

    Optional<AggregatedReadingEntity> findBySensorIdAndHour(UUID sensorId, Instant hour);

    List<AggregatedReadingEntity> findBySensorIdOrderByHourAsc(UUID sensorId);
}
