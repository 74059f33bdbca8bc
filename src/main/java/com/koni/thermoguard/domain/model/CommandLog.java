package com.koni.thermoguard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one actuation attempt, written whether or not the command succeeded.
 */
@Getter
@AllArgsConstructor
public class CommandLog {

    public static final String RESPONSE_OK = "OK";
    public static final String RESPONSE_FAILED = "Failed to send command";

    private final UUID id;
    private final UUID airConditionerId;
    private final IrCommandType command;
    private final UUID executedBy;
    private final boolean success;
    private final String response;
    private final boolean automatic;
    private final Instant createdAt;

    public static CommandLog record(UUID airConditionerId, IrCommandType command, Actor actor, boolean success) {
        return new CommandLog(
                UUID.randomUUID(),
                airConditionerId,
                command,
                actor.getUserId().orElse(null),
                success,
                success ? RESPONSE_OK : RESPONSE_FAILED,
                actor.isSystem(),
                Instant.now()
        );
    }
}
