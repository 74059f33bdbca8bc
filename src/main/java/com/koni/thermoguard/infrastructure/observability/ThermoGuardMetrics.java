package com.koni.thermoguard.infrastructure.observability;

import com.koni.thermoguard.domain.model.AlertSeverity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking pipeline metrics.
 * Provides counters and timers for monitoring ingestion, alerting, actuation and fan-out.
 */
@Slf4j
@Component
public class ThermoGuardMetrics {

    private final MeterRegistry registry;
    private final Counter readingsReceived;
    private final Counter readingsRejected;
    private final Counter alertsSuppressed;
    private final Counter alertsEscalated;
    private final Counter commandsSucceeded;
    private final Counter commandsFailed;
    private final Counter broadcastFailures;
    private final Counter sensorsMarkedOffline;
    private final Counter dlqMessagesSent;
    private final Timer pipelineTime;

    public ThermoGuardMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.readingsReceived = Counter.builder("thermoguard.readings.received.total")
                .description("Total readings submitted")
                .register(registry);

        this.readingsRejected = Counter.builder("thermoguard.readings.rejected.total")
                .description("Total readings rejected by validation or sensor resolution")
                .register(registry);

        this.alertsSuppressed = Counter.builder("thermoguard.alerts.suppressed.total")
                .description("Total alerts suppressed by the cooldown window")
                .register(registry);

        this.alertsEscalated = Counter.builder("thermoguard.alerts.escalated.total")
                .description("Total critical alerts reported as unattended")
                .register(registry);

        this.commandsSucceeded = Counter.builder("thermoguard.commands.total")
                .description("Total IR commands issued")
                .tag("outcome", "success")
                .register(registry);

        this.commandsFailed = Counter.builder("thermoguard.commands.total")
                .description("Total IR commands issued")
                .tag("outcome", "failure")
                .register(registry);

        this.broadcastFailures = Counter.builder("thermoguard.broadcast.failures.total")
                .description("Total notifications that could not be delivered")
                .register(registry);

        this.sensorsMarkedOffline = Counter.builder("thermoguard.sensors.offline.total")
                .description("Total sensors transitioned to offline by the liveness sweep")
                .register(registry);

        this.dlqMessagesSent = Counter.builder("thermoguard.ir.dlq.sent.total")
                .description("Total IR recordings sent to the Dead Letter Queue")
                .register(registry);

        this.pipelineTime = Timer.builder("thermoguard.pipeline.time")
                .description("Time to ingest a reading, including alerting and actuation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordReadingReceived() {
        readingsReceived.increment();
    }

    public void recordReadingRejected() {
        readingsRejected.increment();
    }

    /**
     * Increment the created-alerts counter for the given severity.
     */
    public void recordAlertCreated(AlertSeverity severity) {
        Counter.builder("thermoguard.alerts.created.total")
                .description("Total alerts created")
                .tag("severity", severity.code())
                .register(registry)
                .increment();
    }

    public void recordAlertSuppressed() {
        alertsSuppressed.increment();
    }

    public void recordAlertEscalated() {
        alertsEscalated.increment();
    }

    public void recordCommand(boolean success) {
        if (success) {
            commandsSucceeded.increment();
        } else {
            commandsFailed.increment();
        }
    }

    public void recordBroadcastFailure() {
        broadcastFailures.increment();
        log.debug("Broadcast failure counter incremented");
    }

    public void recordSensorMarkedOffline() {
        sensorsMarkedOffline.increment();
    }

    /**
     * Increment the failure counter of an absorbed pipeline step.
     *
     * @param step the step name, e.g. {@code alert-evaluation}
     */
    public void recordStepFailure(String step) {
        Counter.builder("thermoguard.pipeline.step.failures.total")
                .description("Total downstream pipeline steps that failed and were absorbed")
                .tag("step", step)
                .register(registry)
                .increment();
    }

    public void recordDlqMessageSent() {
        dlqMessagesSent.increment();
        log.debug("DLQ message sent counter incremented");
    }

    /**
     * Record the processing time of one ingestion.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordPipelineTime(Supplier<T> operation) {
        return pipelineTime.record(operation);
    }
}
