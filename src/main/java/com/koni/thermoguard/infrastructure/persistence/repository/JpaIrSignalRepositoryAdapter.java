package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.domain.model.IrSignal;
import com.koni.thermoguard.domain.repository.IrSignalRepository;
import com.koni.thermoguard.infrastructure.persistence.entity.IrSignalEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaIrSignalRepositoryAdapter implements IrSignalRepository {

    private final IrSignalJpaRepository jpaRepository;
    private final AirConditionerJpaRepository airConditionerJpaRepository;

    @Override
    public Optional<IrSignal> findByAirConditionerIdAndCommandType(UUID airConditionerId, IrCommandType commandType) {
        return jpaRepository.findByAirConditionerIdAndCommandType(airConditionerId, commandType).map(this::toDomain);
    }

    @Override
    public List<IrSignal> findByAirConditionerId(UUID airConditionerId) {
        return jpaRepository.findByAirConditionerIdOrderByCommandTypeAsc(airConditionerId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Re-learning a command replaces the stored signal; the row id stays the same.
     */
    @Override
    @Transactional
    public IrSignal upsert(IrSignal signal) {
        if (signal == null) {
            throw new IllegalArgumentException("IrSignal cannot be null");
        }
        IrSignalEntity entity = jpaRepository
                .findByAirConditionerIdAndCommandType(signal.getAirConditionerId(), signal.getCommandType())
                .orElseGet(() -> {
                    IrSignalEntity created = new IrSignalEntity();
                    created.setId(signal.getId());
                    created.setAirConditioner(
                            airConditionerJpaRepository.getReferenceById(signal.getAirConditionerId()));
                    created.setAirConditionerId(signal.getAirConditionerId());
                    created.setCommandType(signal.getCommandType());
                    return created;
                });
        entity.setRawSignal(signal.getRawSignal());
        entity.setProtocol(signal.getProtocol());
        return toDomain(jpaRepository.save(entity));
    }

    private IrSignal toDomain(IrSignalEntity entity) {
        return new IrSignal(
                entity.getId(),
                entity.getAirConditionerId(),
                entity.getCommandType(),
                entity.getRawSignal(),
                entity.getProtocol()
        );
    }
}
