package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.domain.repository.RoomRepository;
import com.koni.thermoguard.infrastructure.persistence.entity.RoomEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA adapter for RoomRepository.
 * Maps between the Room domain model and RoomEntity.
 */
@Component
@RequiredArgsConstructor
public class JpaRoomRepositoryAdapter implements RoomRepository {

    private final RoomJpaRepository jpaRepository;

    @Override
    public Optional<Room> findById(UUID roomId) {
        if (roomId == null) {
            throw new IllegalArgumentException("RoomId cannot be null");
        }
        return jpaRepository.findById(roomId).map(this::toDomain);
    }

    @Override
    public boolean existsById(UUID roomId) {
        if (roomId == null) {
            throw new IllegalArgumentException("RoomId cannot be null");
        }
        return jpaRepository.existsById(roomId);
    }

    @Override
    public void save(Room room) {
        if (room == null) {
            throw new IllegalArgumentException("Room cannot be null");
        }
        room.validate();

        RoomEntity entity = new RoomEntity();
        entity.setId(room.getId());
        entity.setName(room.getName());
        entity.setTargetTemperature(room.getTargetTemperature());
        entity.setTargetHumidity(room.getTargetHumidity());
        entity.setOperationMode(room.getOperationMode());
        entity.setActive(room.isActive());
        jpaRepository.save(entity);
    }

    @Override
    @Transactional
    public boolean updateSettings(Room room) {
        if (room == null) {
            throw new IllegalArgumentException("Room cannot be null");
        }
        return jpaRepository.updateSettings(room.getId(), room.getTargetTemperature(), room.getTargetHumidity(),
                room.getOperationMode(), Instant.now()) == 1;
    }

    private Room toDomain(RoomEntity entity) {
        return new Room(
                entity.getId(),
                entity.getName(),
                entity.getTargetTemperature(),
                entity.getTargetHumidity(),
                entity.getOperationMode(),
                entity.isActive()
        );
    }
}
