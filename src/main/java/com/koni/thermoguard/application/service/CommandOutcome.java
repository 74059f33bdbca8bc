package com.koni.thermoguard.application.service;

import com.koni.thermoguard.domain.model.AcStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Result of a turn-on/turn-off request: whether the command went through, a human-readable message,
 * and the status the unit is in afterwards.
 */
@Getter
@AllArgsConstructor
@ToString
public class CommandOutcome {

    private final UUID airConditionerId;
    private final boolean success;
    private final String message;
    private final AcStatus status;
}
