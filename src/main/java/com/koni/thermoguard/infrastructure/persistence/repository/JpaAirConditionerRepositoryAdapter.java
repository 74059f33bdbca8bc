package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.model.AcStatus;
import com.koni.thermoguard.domain.model.AirConditioner;
import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.domain.repository.AirConditionerRepository;
import com.koni.thermoguard.infrastructure.persistence.entity.AirConditionerEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for AirConditionerRepository.
 * Status changes are written with a targeted update so the IR code map is never rewritten by them.
 */
@Component
@RequiredArgsConstructor
public class JpaAirConditionerRepositoryAdapter implements AirConditionerRepository {

    private final AirConditionerJpaRepository jpaRepository;
    private final RoomJpaRepository roomJpaRepository;

    @Override
    public Optional<AirConditioner> findById(UUID airConditionerId) {
        if (airConditionerId == null) {
            throw new IllegalArgumentException("AirConditionerId cannot be null");
        }
        return jpaRepository.findById(airConditionerId).map(this::toDomain);
    }

    @Override
    public List<AirConditioner> findByRoomId(UUID roomId) {
        return jpaRepository.findByRoomIdOrderByNameAsc(roomId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<AirConditioner> findFirstActiveByRoomIdAndStatus(UUID roomId, AcStatus status) {
        return jpaRepository.findFirstByRoomIdAndActiveTrueAndStatusOrderByNameAsc(roomId, status)
                .map(this::toDomain);
    }

    @Override
    public List<AirConditioner> findActiveByStatus(UUID roomId, AcStatus status) {
        List<AirConditionerEntity> entities = roomId == null
                ? jpaRepository.findByActiveTrueAndStatusOrderByNameAsc(status)
                : jpaRepository.findByRoomIdAndActiveTrueAndStatusOrderByNameAsc(roomId, status);
        return entities.stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public void save(AirConditioner airConditioner) {
        if (airConditioner == null) {
            throw new IllegalArgumentException("AirConditioner cannot be null");
        }
        AirConditionerEntity entity = new AirConditionerEntity();
        entity.setId(airConditioner.getId());
        entity.setRoom(roomJpaRepository.getReferenceById(airConditioner.getRoomId()));
        entity.setRoomId(airConditioner.getRoomId());
        entity.setName(airConditioner.getName());
        entity.setTransmitterDeviceId(airConditioner.getTransmitterDeviceId());
        entity.setStatus(airConditioner.getStatus());
        entity.setActive(airConditioner.isActive());
        entity.setLastCommand(airConditioner.getLastCommand());
        entity.setIrCodes(new EnumMap<>(IrCommandType.class));
        entity.getIrCodes().putAll(airConditioner.getIrCodes());
        jpaRepository.save(entity);
    }

    @Override
    @Transactional
    public void updateStatus(UUID airConditionerId, AcStatus status, Instant lastCommand) {
        if (jpaRepository.updateStatus(airConditionerId, status, lastCommand) == 0) {
            throw new NotFoundException("Air conditioner not found: " + airConditionerId);
        }
    }

    @Override
    @Transactional
    public void putIrCode(UUID airConditionerId, IrCommandType commandType, String rawSignal) {
        AirConditionerEntity entity = jpaRepository.findById(airConditionerId)
                .orElseThrow(() -> new NotFoundException("Air conditioner not found: " + airConditionerId));
        entity.getIrCodes().put(commandType, rawSignal);
        jpaRepository.save(entity);
    }

    private AirConditioner toDomain(AirConditionerEntity entity) {
        return new AirConditioner(
                entity.getId(),
                entity.getRoomId(),
                entity.getName(),
                entity.getTransmitterDeviceId(),
                entity.isActive(),
                entity.getStatus(),
                entity.getIrCodes(),
                entity.getLastCommand()
        );
    }
}
