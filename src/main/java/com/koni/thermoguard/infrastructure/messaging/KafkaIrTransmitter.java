package com.koni.thermoguard.infrastructure.messaging;

import com.koni.thermoguard.application.port.IrTransmitter;
import com.koni.thermoguard.domain.exception.TransmitterUnavailableException;
import com.koni.thermoguard.domain.model.IrCommandType;
import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Kafka implementation of the IrTransmitter port with Circuit Breaker protection.
 *
 * Features:
 * - Commands are keyed by transmitter device id to keep per-transmitter ordering
 * - The send is awaited for at most the configured IR timeout; a timeout counts as a failure
 * - While the circuit is OPEN, commands fail fast
 * - Every failure is reported as {@code false}, never thrown
 */
@Slf4j
@Component
public class KafkaIrTransmitter implements IrTransmitter {

    private final KafkaTemplate<String, IrCommandMessage> kafkaTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String topic;
    private final Duration timeout;

    public KafkaIrTransmitter(
            KafkaTemplate<String, IrCommandMessage> kafkaTemplate,
            CircuitBreaker irTransmitterCircuitBreaker,
            ThermoGuardProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.circuitBreaker = irTransmitterCircuitBreaker;
        this.topic = properties.getKafka().getIrCommandTopic();
        this.timeout = properties.getControl().getIrTimeout();

        registerCircuitBreakerEventListeners();
    }

    @Override
    public boolean send(String transmitterDeviceId, IrCommandType commandType, String rawSignal) {
        if (transmitterDeviceId == null) {
            throw new IllegalArgumentException("transmitterDeviceId cannot be null");
        }
        return dispatch(IrCommandMessage.transmit(transmitterDeviceId, commandType, rawSignal));
    }

    @Override
    public boolean enterRecordingMode(String transmitterDeviceId, UUID airConditionerId, IrCommandType commandType) {
        if (transmitterDeviceId == null) {
            throw new IllegalArgumentException("transmitterDeviceId cannot be null");
        }
        return dispatch(IrCommandMessage.record(transmitterDeviceId, airConditionerId, commandType));
    }

    private boolean dispatch(IrCommandMessage message) {
        Supplier<SendResult<String, IrCommandMessage>> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker, () -> sendAndWait(message));
        try {
            decorated.get();
            return true;
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker is OPEN, IR command not sent: deviceId={}, action={}, command={}",
                    message.getDeviceId(), message.getAction(), message.getCommandType());
            return false;
        } catch (RuntimeException e) {
            log.warn("IR command not sent: deviceId={}, action={}, command={}, error={}",
                    message.getDeviceId(), message.getAction(), message.getCommandType(), e.getMessage());
            return false;
        }
    }

    private SendResult<String, IrCommandMessage> sendAndWait(IrCommandMessage message) {
        try {
            CompletableFuture<SendResult<String, IrCommandMessage>> future =
                    kafkaTemplate.send(topic, message.getDeviceId(), message);
            SendResult<String, IrCommandMessage> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

            log.debug("IR command published: topic={}, partition={}, offset={}, deviceId={}, action={}",
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    message.getDeviceId(),
                    message.getAction());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransmitterUnavailableException("Interrupted while sending IR command", e);
        } catch (TimeoutException e) {
            throw new TransmitterUnavailableException("IR command not acknowledged within " + timeout, e);
        } catch (ExecutionException e) {
            throw new TransmitterUnavailableException("IR command rejected: " + e.getCause().getMessage(), e);
        } catch (RuntimeException e) {
            throw new TransmitterUnavailableException("IR command could not be sent: " + e.getMessage(), e);
        }
    }

    private void registerCircuitBreakerEventListeners() {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("IR transmitter circuit breaker: {} -> {} (failure rate: {}%)",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState(),
                        circuitBreaker.getMetrics().getFailureRate()))
                .onCallNotPermitted(event -> log.debug("IR transmitter call not permitted (circuit is OPEN)"));
    }
}
