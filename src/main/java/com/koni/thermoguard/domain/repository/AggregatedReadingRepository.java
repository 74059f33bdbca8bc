package com.koni.thermoguard.domain.repository;

import com.koni.thermoguard.domain.model.AggregatedReading;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AggregatedReadingRepository {

    Optional<AggregatedReading> findBySensorIdAndHour(UUID sensorId, Instant hour);

    List<AggregatedReading> findBySensorId(UUID sensorId);

    /**
     * Inserts the aggregate, or replaces the one already stored for the same (sensor, hour).
     */
    void upsert(AggregatedReading aggregate);
}
