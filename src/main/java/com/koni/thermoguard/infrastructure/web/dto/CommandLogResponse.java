package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.domain.model.CommandLog;
import com.koni.thermoguard.domain.model.IrCommandType;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
@AllArgsConstructor
public class CommandLogResponse {

    private final UUID commandLogId;
    private final IrCommandType command;
    private final UUID executedBy;
    private final boolean success;
    private final String response;
    private final boolean automatic;
    private final Instant createdAt;

    public static CommandLogResponse from(CommandLog log) {
        return new CommandLogResponse(log.getId(), log.getCommand(), log.getExecutedBy(), log.isSuccess(),
                log.getResponse(), log.isAutomatic(), log.getCreatedAt());
    }
}
