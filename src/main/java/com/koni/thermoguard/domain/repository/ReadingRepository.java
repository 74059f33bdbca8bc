package com.koni.thermoguard.domain.repository;

import com.koni.thermoguard.domain.model.Reading;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of raw readings.
 */
public interface ReadingRepository {

    void save(Reading reading);

    Optional<Reading> findLatestBySensorId(UUID sensorId);

    /**
     * Readings of a sensor with {@code from <= timestamp < to}, oldest first.
     */
    List<Reading> findBySensorIdBetween(UUID sensorId, Instant from, Instant to);

    List<Reading> findBySensorIdOlderThan(UUID sensorId, Instant cutoff);

    int deleteOlderThan(Instant cutoff);

    int deleteBySensorIdOlderThan(UUID sensorId, Instant cutoff);
}
