package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.AggregatedReading;
import com.koni.thermoguard.domain.repository.AggregatedReadingRepository;
import com.koni.thermoguard.infrastructure.persistence.entity.AggregatedReadingEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaAggregatedReadingRepositoryAdapter implements AggregatedReadingRepository {

    private final AggregatedReadingJpaRepository jpaRepository;
    private final SensorJpaRepository sensorJpaRepository;

    @Override
    public Optional<AggregatedReading> findBySensorIdAndHour(UUID sensorId, Instant hour) {
        return jpaRepository.findBySensorIdAndHour(sensorId, hour).map(this::toDomain);
    }

    @Override
    public List<AggregatedReading> findBySensorId(UUID sensorId) {
        return jpaRepository.findBySensorIdOrderByHourAsc(sensorId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Updates the row of the same (sensor, hour) in place, or inserts a new one.
     */
    @Override
    @Transactional
    public void upsert(AggregatedReading aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("AggregatedReading cannot be null");
        }
        AggregatedReadingEntity entity = jpaRepository
                .findBySensorIdAndHour(aggregate.getSensorId(), aggregate.getHour())
                .orElseGet(() -> {
                    AggregatedReadingEntity created = new AggregatedReadingEntity();
                    created.setId(aggregate.getId());
                    created.setSensor(sensorJpaRepository.getReferenceById(aggregate.getSensorId()));
                    created.setSensorId(aggregate.getSensorId());
                    created.setHour(aggregate.getHour());
                    return created;
                });

        entity.setTemperatureMin(aggregate.getTemperatureMin());
        entity.setTemperatureMax(aggregate.getTemperatureMax());
        entity.setTemperatureAvg(aggregate.getTemperatureAvg());
        entity.setHumidityMin(aggregate.getHumidityMin());
        entity.setHumidityMax(aggregate.getHumidityMax());
        entity.setHumidityAvg(aggregate.getHumidityAvg());
        entity.setReadingCount(aggregate.getReadingCount());
        entity.setTemperatureCount(aggregate.getTemperatureCount());
        entity.setHumidityCount(aggregate.getHumidityCount());
        jpaRepository.save(entity);
    }

    private AggregatedReading toDomain(AggregatedReadingEntity entity) {
        return new AggregatedReading(
                entity.getId(),
                entity.getSensorId(),
                entity.getHour(),
                entity.getTemperatureMin(),
                entity.getTemperatureMax(),
                entity.getTemperatureAvg(),
                entity.getHumidityMin(),
                entity.getHumidityMax(),
                entity.getHumidityAvg(),
                entity.getReadingCount(),
                entity.getTemperatureCount(),
                entity.getHumidityCount()
        );
    }
}
