package com.koni.thermoguard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * A learned infrared waveform for one command of one air conditioner.
 */
@Getter
@AllArgsConstructor
public class IrSignal {

    private final UUID id;
    private final UUID airConditionerId;
    private final IrCommandType commandType;
    private final String rawSignal;
    private final String protocol;

    public static IrSignal learned(UUID airConditionerId, IrCommandType commandType, String rawSignal,
                                   String protocol) {
        return new IrSignal(UUID.randomUUID(), airConditionerId, commandType, rawSignal, protocol);
    }
}
