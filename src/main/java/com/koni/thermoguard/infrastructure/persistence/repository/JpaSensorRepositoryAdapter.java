package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.Sensor;
import com.koni.thermoguard.domain.repository.SensorRepository;
import com.koni.thermoguard.infrastructure.persistence.entity.SensorEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for SensorRepository.
 *
 * Liveness changes never go through {@code save}: they are conditional updates of
 * {@code is_online}/{@code last_seen} only.
 */
@Component
@RequiredArgsConstructor
public class JpaSensorRepositoryAdapter implements SensorRepository {

    private final SensorJpaRepository jpaRepository;
    private final RoomJpaRepository roomJpaRepository;

    @Override
    public Optional<Sensor> findById(UUID sensorId) {
        if (sensorId == null) {
            throw new IllegalArgumentException("SensorId cannot be null");
        }
        return jpaRepository.findById(sensorId).map(this::toDomain);
    }

    @Override
    public Optional<Sensor> findByDeviceId(String deviceId) {
        if (deviceId == null) {
            throw new IllegalArgumentException("DeviceId cannot be null");
        }
        return jpaRepository.findByDeviceId(deviceId).map(this::toDomain);
    }

    @Override
    public boolean existsByDeviceId(String deviceId) {
        return jpaRepository.existsByDeviceId(deviceId);
    }

    @Override
    public List<Sensor> findAll() {
        return jpaRepository.findAllByOrderByNameAsc().stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public List<Sensor> findByRoomId(UUID roomId) {
        return jpaRepository.findByRoomIdOrderByNameAsc(roomId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public void save(Sensor sensor) {
        if (sensor == null) {
            throw new IllegalArgumentException("Sensor cannot be null");
        }
        SensorEntity entity = new SensorEntity();
        entity.setId(sensor.getId());
        entity.setRoom(roomJpaRepository.getReferenceById(sensor.getRoomId()));
        entity.setRoomId(sensor.getRoomId());
        entity.setDeviceId(sensor.getDeviceId());
        entity.setName(sensor.getName());
        entity.setOnline(sensor.isOnline());
        entity.setLastSeen(sensor.getLastSeen());
        jpaRepository.save(entity);
    }

    /**
     * Refreshes {@code last_seen} of an online sensor, or flips an offline one to online.
     */
    @Override
    @Transactional
    public boolean markOnline(UUID sensorId, Instant seenAt) {
        if (jpaRepository.touchIfOnline(sensorId, seenAt) == 1) {
            return false;
        }
        return jpaRepository.markOnlineIfOffline(sensorId, seenAt) == 1;
    }

    @Override
    public List<Sensor> findOnlineNotSeenSince(Instant threshold) {
        return jpaRepository.findByOnlineTrueAndLastSeenBefore(threshold).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public boolean markOffline(UUID sensorId, Instant threshold) {
        return jpaRepository.markOfflineIfStale(sensorId, threshold, Instant.now()) == 1;
    }

    private Sensor toDomain(SensorEntity entity) {
        return new Sensor(
                entity.getId(),
                entity.getRoomId(),
                entity.getDeviceId(),
                entity.getName(),
                entity.isOnline(),
                entity.getLastSeen()
        );
    }
}
