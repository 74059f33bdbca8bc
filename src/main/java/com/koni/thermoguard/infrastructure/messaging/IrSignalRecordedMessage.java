package com.koni.thermoguard.infrastructure.messaging;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Result of a learning session reported back by a transmitter.
 * {@code commandType} stays a string so that an unknown code is rejected by the consumer, not the deserializer.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "rawSignal")
public final class IrSignalRecordedMessage {

    private final UUID airConditionerId;
    private final String commandType;
    private final String rawSignal;
    private final String protocol;
    private final boolean success;
    private final String error;

    @JsonCreator
    public IrSignalRecordedMessage(
            @JsonProperty("airConditionerId") UUID airConditionerId,
            @JsonProperty("commandType") String commandType,
            @JsonProperty("rawSignal") String rawSignal,
            @JsonProperty("protocol") String protocol,
            @JsonProperty("success") boolean success,
            @JsonProperty("error") String error) {
        this.airConditionerId = airConditionerId;
        this.commandType = commandType;
        this.rawSignal = rawSignal;
        this.protocol = protocol;
        this.success = success;
        this.error = error;
    }
}
