package com.koni.thermoguard.infrastructure.observability;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the IR transmitter link.
 *
 * Reports the state of the transmitter circuit breaker:
 * - CLOSED / HALF_OPEN: UP
 * - OPEN / FORCED_OPEN: DEGRADED (commands fail fast, monitoring keeps running)
 * - DISABLED / METRICS_ONLY: UNKNOWN
 *
 * The service stays usable without the transmitter, so this indicator never reports DOWN.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IrTransmitterHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "IR commands are failing fast");

    private final CircuitBreaker irTransmitterCircuitBreaker;

    @Override
    public Health health() {
        CircuitBreaker.State state = irTransmitterCircuitBreaker.getState();
        CircuitBreaker.Metrics metrics = irTransmitterCircuitBreaker.getMetrics();

        Health.Builder builder;
        switch (state) {
            case CLOSED:
            case HALF_OPEN:
                builder = Health.up();
                break;
            case OPEN:
            case FORCED_OPEN:
                log.debug("IR transmitter circuit breaker is {}", state);
                builder = Health.status(DEGRADED);
                break;
            default:
                builder = Health.unknown();
                break;
        }
        return builder
                .withDetail("circuitBreaker", irTransmitterCircuitBreaker.getName())
                .withDetail("state", state.name())
                .withDetail("failureRate", metrics.getFailureRate())
                .withDetail("bufferedCalls", metrics.getNumberOfBufferedCalls())
                .withDetail("notPermittedCalls", metrics.getNumberOfNotPermittedCalls())
                .build();
    }
}
