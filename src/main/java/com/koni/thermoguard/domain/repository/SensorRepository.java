package com.koni.thermoguard.domain.repository;

import com.koni.thermoguard.domain.model.Sensor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for sensors and their liveness state.
 * Liveness mutations are single-statement updates of the liveness columns only, so that concurrent
 * ingestion and sweeps never overwrite unrelated fields.
 */
public interface SensorRepository {

    Optional<Sensor> findById(UUID sensorId);

    Optional<Sensor> findByDeviceId(String deviceId);

    boolean existsByDeviceId(String deviceId);

    List<Sensor> findAll();

    List<Sensor> findByRoomId(UUID roomId);

    void save(Sensor sensor);

    /**
     * Sets {@code online=true, lastSeen=seenAt}.
     *
     * @return true if the sensor was offline before this call
     */
    boolean markOnline(UUID sensorId, Instant seenAt);

    /**
     * Online sensors whose last contact is older than the given instant.
     */
    List<Sensor> findOnlineNotSeenSince(Instant threshold);

    /**
     * Compare-and-set {@code online: true -> false}, applied only while the sensor is still stale.
     *
     * @return true if this call performed the transition
     */
    boolean markOffline(UUID sensorId, Instant threshold);
}
