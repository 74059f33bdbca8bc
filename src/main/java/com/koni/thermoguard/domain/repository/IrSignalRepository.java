package com.koni.thermoguard.domain.repository;

import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.domain.model.IrSignal;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface IrSignalRepository {

    Optional<IrSignal> findByAirConditionerIdAndCommandType(UUID airConditionerId, IrCommandType commandType);

    List<IrSignal> findByAirConditionerId(UUID airConditionerId);

    /**
     * Stores the signal, replacing any earlier recording of the same (air conditioner, command).
     *
     * @return the stored signal
     */
    IrSignal upsert(IrSignal signal);
}
