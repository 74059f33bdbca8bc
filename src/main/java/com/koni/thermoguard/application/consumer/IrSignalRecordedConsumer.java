package com.koni.thermoguard.application.consumer;

import com.koni.thermoguard.application.service.AirConditionerService;
import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.infrastructure.messaging.IrSignalRecordedMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * Stores IR signals learned by transmitters in recording mode.
 *
 * Failed learning sessions are logged and acknowledged. A message that names an unknown unit or
 * command is not retried and goes straight to the DLQ; other failures are retried first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IrSignalRecordedConsumer {

    private final AirConditionerService airConditionerService;

    @KafkaListener(
            topics = "${thermoguard.kafka.ir-recorded-topic:thermoguard.ir.recorded}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(IrSignalRecordedMessage message, Acknowledgment acknowledgment) {
        log.debug("Received IrSignalRecordedMessage: {}", message);

        if (!message.isSuccess()) {
            log.warn("IR learning failed on transmitter: acId={}, command={}, error={}",
                    message.getAirConditionerId(), message.getCommandType(), message.getError());
            acknowledgment.acknowledge();
            return;
        }

        try {
            airConditionerService.recordIrSignal(
                    message.getAirConditionerId(),
                    IrCommandType.fromCode(message.getCommandType()),
                    message.getRawSignal(),
                    message.getProtocol());
            acknowledgment.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error storing recorded IR signal: acId={}, command={}",
                    message.getAirConditionerId(), message.getCommandType(), e);
            throw e;
        }
    }
}
