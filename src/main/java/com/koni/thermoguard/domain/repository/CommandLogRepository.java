package com.koni.thermoguard.domain.repository;

import com.koni.thermoguard.domain.model.CommandLog;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface CommandLogRepository {

    void save(CommandLog commandLog);

    /**
     * Most recent entries of one air conditioner, newest first.
     */
    List<CommandLog> findRecentByAirConditionerId(UUID airConditionerId, int limit);

    int deleteOlderThan(Instant cutoff);
}
