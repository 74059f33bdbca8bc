package com.koni.thermoguard.infrastructure.messaging;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.thermoguard.domain.model.IrCommandType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Instruction for an IR transmitter, keyed on the wire by the transmitter's device id.
 * {@code action} is {@code transmit} (replay {@code signal}) or {@code record} (learn a command).
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "signal")
public final class IrCommandMessage {

    public static final String ACTION_TRANSMIT = "transmit";
    public static final String ACTION_RECORD = "record";

    private final UUID messageId;
    private final String deviceId;
    private final String action;
    private final UUID airConditionerId;
    private final IrCommandType commandType;
    private final String signal;
    private final Instant issuedAt;

    @JsonCreator
    public IrCommandMessage(
            @JsonProperty("messageId") UUID messageId,
            @JsonProperty("deviceId") String deviceId,
            @JsonProperty("action") String action,
            @JsonProperty("airConditionerId") UUID airConditionerId,
            @JsonProperty("commandType") IrCommandType commandType,
            @JsonProperty("signal") String signal,
            @JsonProperty("issuedAt") Instant issuedAt) {
        this.messageId = messageId;
        this.deviceId = deviceId;
        this.action = action;
        this.airConditionerId = airConditionerId;
        this.commandType = commandType;
        this.signal = signal;
        this.issuedAt = issuedAt;
    }

    public static IrCommandMessage transmit(String deviceId, IrCommandType commandType, String signal) {
        return new IrCommandMessage(UUID.randomUUID(), deviceId, ACTION_TRANSMIT, null, commandType, signal,
                Instant.now());
    }

    public static IrCommandMessage record(String deviceId, UUID airConditionerId, IrCommandType commandType) {
        return new IrCommandMessage(UUID.randomUUID(), deviceId, ACTION_RECORD, airConditionerId, commandType,
                null, Instant.now());
    }
}
