package com.koni.thermoguard.domain.repository;

import com.koni.thermoguard.domain.model.Room;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for rooms.
 * Implemented by infrastructure adapters; the domain depends only on this abstraction.
 */
public interface RoomRepository {

    Optional<Room> findById(UUID roomId);

    boolean existsById(UUID roomId);

    void save(Room room);

    /**
     * Writes only the setpoint and mode columns of the room.
     *
     * @return true if the room exists and was updated
     */
    boolean updateSettings(Room room);
}
