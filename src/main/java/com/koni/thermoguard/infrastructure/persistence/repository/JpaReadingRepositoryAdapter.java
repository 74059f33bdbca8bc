package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.repository.ReadingRepository;
import com.koni.thermoguard.infrastructure.persistence.entity.ReadingEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for ReadingRepository.
 */
@Component
@RequiredArgsConstructor
public class JpaReadingRepositoryAdapter implements ReadingRepository {

    private final ReadingJpaRepository jpaRepository;
    private final SensorJpaRepository sensorJpaRepository;

    @Override
    public void save(Reading reading) {
        if (reading == null) {
            throw new IllegalArgumentException("Reading cannot be null");
        }
        ReadingEntity entity = new ReadingEntity();
        entity.setId(reading.getId());
        entity.setSensor(sensorJpaRepository.getReferenceById(reading.getSensorId()));
        entity.setSensorId(reading.getSensorId());
        entity.setTemperature(reading.getTemperature());
        entity.setHumidity(reading.getHumidity());
        entity.setTimestamp(reading.getTimestamp());
        jpaRepository.save(entity);
    }

    @Override
    public Optional<Reading> findLatestBySensorId(UUID sensorId) {
        return jpaRepository.findFirstBySensorIdOrderByTimestampDesc(sensorId).map(this::toDomain);
    }

    @Override
    public List<Reading> findBySensorIdBetween(UUID sensorId, Instant from, Instant to) {
        return jpaRepository
                .findBySensorIdAndTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAsc(sensorId, from, to)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public List<Reading> findBySensorIdOlderThan(UUID sensorId, Instant cutoff) {
        return jpaRepository.findBySensorIdAndTimestampBeforeOrderByTimestampAsc(sensorId, cutoff).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public int deleteOlderThan(Instant cutoff) {
        return jpaRepository.deleteOlderThan(cutoff);
    }

    @Override
    @Transactional
    public int deleteBySensorIdOlderThan(UUID sensorId, Instant cutoff) {
        return jpaRepository.deleteBySensorIdOlderThan(sensorId, cutoff);
    }

    private Reading toDomain(ReadingEntity entity) {
        return new Reading(
                entity.getId(),
                entity.getSensorId(),
                entity.getTemperature(),
                entity.getHumidity(),
                entity.getTimestamp()
        );
    }
}
