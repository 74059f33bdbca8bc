package com.koni.thermoguard.domain.repository;

import com.koni.thermoguard.domain.model.AcStatus;
import com.koni.thermoguard.domain.model.AirConditioner;
import com.koni.thermoguard.domain.model.IrCommandType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for air conditioners.
 */
public interface AirConditionerRepository {

    Optional<AirConditioner> findById(UUID airConditionerId);

    List<AirConditioner> findByRoomId(UUID roomId);

    /**
     * First active unit of the room in the given status, ordered by name.
     */
    Optional<AirConditioner> findFirstActiveByRoomIdAndStatus(UUID roomId, AcStatus status);

    /**
     * Active units in the given status; all rooms when {@code roomId} is null.
     */
    List<AirConditioner> findActiveByStatus(UUID roomId, AcStatus status);

    void save(AirConditioner airConditioner);

    /**
     * Writes only {@code status} and {@code lastCommand}.
     */
    void updateStatus(UUID airConditionerId, AcStatus status, Instant lastCommand);

    /**
     * Sets the learned code for one command, leaving the other codes untouched.
     */
    void putIrCode(UUID airConditionerId, IrCommandType commandType, String rawSignal);
}
