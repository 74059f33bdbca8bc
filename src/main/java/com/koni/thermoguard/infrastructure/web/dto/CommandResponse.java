package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.application.service.CommandOutcome;
import com.koni.thermoguard.domain.model.AcStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

@Getter
@AllArgsConstructor
public class CommandResponse {

    private final UUID airConditionerId;
    private final boolean success;
    private final String message;
    private final AcStatus status;

    public static CommandResponse from(CommandOutcome outcome) {
        return new CommandResponse(outcome.getAirConditionerId(), outcome.isSuccess(), outcome.getMessage(),
                outcome.getStatus());
    }
}
