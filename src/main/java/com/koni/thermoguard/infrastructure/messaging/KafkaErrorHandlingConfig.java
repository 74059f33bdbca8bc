package com.koni.thermoguard.infrastructure.messaging;

import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import com.koni.thermoguard.infrastructure.observability.ThermoGuardMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

import java.nio.charset.StandardCharsets;

/**
 * Error handling for the recorded-signal consumer.
 *
 * - Exponential backoff retry strategy (1s, 2s, 4s), at most 3 attempts
 * - Validation and not-found failures are not retried
 * - Exhausted records go to the DLQ topic with retry count and error headers
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class KafkaErrorHandlingConfig {

    private static final long INITIAL_INTERVAL = 1000L;
    private static final double MULTIPLIER = 2.0;
    private static final int MAX_ATTEMPTS = 3;

    private final ThermoGuardMetrics metrics;
    private final ThermoGuardProperties properties;

    @Bean
    public CommonErrorHandler errorHandler(KafkaTemplate<?, ?> kafkaTemplate) {
        String dlqTopic = properties.getKafka().getIrRecordedDlqTopic();

        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaTemplate,
                (consumerRecord, exception) -> {
                    log.error("Sending message to DLQ: topic={}, key={}, value={}, error={}",
                            consumerRecord.topic(),
                            consumerRecord.key(),
                            consumerRecord.value(),
                            exception.getMessage(),
                            exception);
                    metrics.recordDlqMessageSent();
                    return new TopicPartition(dlqTopic, -1);
                }
        );

        ExponentialBackOff backOff = new ExponentialBackOff(INITIAL_INTERVAL, MULTIPLIER);
        backOff.setMaxAttempts(MAX_ATTEMPTS);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(ValidationException.class, NotFoundException.class);

        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) -> {
            log.warn("Retry attempt {} for message: topic={}, key={}, error={}",
                    deliveryAttempt,
                    consumerRecord.topic(),
                    consumerRecord.key(),
                    exception.getMessage());

            consumerRecord.headers().add("retry-count",
                    String.valueOf(deliveryAttempt).getBytes(StandardCharsets.UTF_8));
            consumerRecord.headers().add("exception-message",
                    String.valueOf(exception.getMessage()).getBytes(StandardCharsets.UTF_8));
        });

        return errorHandler;
    }
}
