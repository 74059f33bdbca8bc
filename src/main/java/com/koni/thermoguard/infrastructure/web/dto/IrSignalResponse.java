package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.domain.model.IrSignal;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

@Getter
@AllArgsConstructor
public class IrSignalResponse {

    private final UUID signalId;
    private final UUID airConditionerId;
    private final IrCommandType commandType;
    private final String protocol;

    public static IrSignalResponse from(IrSignal signal) {
        return new IrSignalResponse(signal.getId(), signal.getAirConditionerId(), signal.getCommandType(),
                signal.getProtocol());
    }
}
