package com.koni.thermoguard.infrastructure.persistence.repository;

import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.infrastructure.persistence.entity.IrSignalEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IrSignalJpaRepository extends JpaRepository<IrSignalEntity, UUID> {

    Optional<IrSignalEntity> findByAirConditionerIdAndCommandType(UUID airConditionerId, IrCommandType commandType);

    List<IrSignalEntity> findByAirConditionerIdOrderByCommandTypeAsc(UUID airConditionerId);
}
