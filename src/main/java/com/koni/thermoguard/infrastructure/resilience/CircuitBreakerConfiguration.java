package com.koni.thermoguard.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker protecting the IR transmitter channel.
 *
 * While the breaker is OPEN, actuation fails fast instead of waiting for the send timeout on every
 * reading, and the failure is recorded like any other failed command.
 */
@Configuration
public class CircuitBreakerConfiguration {

    /**
     * Configuration:
     * - Sliding window: 10 calls (COUNT_BASED)
     * - Failure threshold: 50%
     * - Wait duration in OPEN state: 30 seconds
     * - Permitted calls in HALF_OPEN: 2
     */
    @Bean
    public CircuitBreakerConfig irTransmitterCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(2)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public CircuitBreaker irTransmitterCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("irTransmitter");
    }
}
