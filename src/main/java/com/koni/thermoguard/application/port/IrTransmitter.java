package com.koni.thermoguard.application.port;

import com.koni.thermoguard.domain.model.IrCommandType;

import java.util.UUID;

/**
 * Port interface for the infrared transmitter devices attached to air conditioners.
 *
 * Both operations report the outcome as a boolean: a timeout, transport error or unavailable
 * channel is a {@code false}, never an exception.
 */
public interface IrTransmitter {

    /**
     * Replays a learned signal on the transmitter.
     *
     * @param transmitterDeviceId device id of the transmitter the AC is paired with
     * @param commandType the command being sent
     * @param rawSignal the learned waveform
     * @return true if the transmitter accepted the command within the timeout
     */
    boolean send(String transmitterDeviceId, IrCommandType commandType, String rawSignal);

    /**
     * Puts the transmitter into learning mode; the captured signal comes back asynchronously.
     *
     * @return true if the request was delivered
     */
    boolean enterRecordingMode(String transmitterDeviceId, UUID airConditionerId, IrCommandType commandType);
}
