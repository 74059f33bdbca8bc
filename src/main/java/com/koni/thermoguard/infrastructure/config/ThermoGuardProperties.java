package com.koni.thermoguard.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunable thresholds and windows of the monitoring pipeline, bound from {@code thermoguard.*}.
 * Defaults match the values the control loop was calibrated with.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "thermoguard")
public class ThermoGuardProperties {

    private Alerts alerts = new Alerts();
    private Control control = new Control();
    private Sensors sensors = new Sensors();
    private Readings readings = new Readings();
    private CommandLogs commandLogs = new CommandLogs();
    private Notifications notifications = new Notifications();
    private Kafka kafka = new Kafka();

    @Getter
    @Setter
    public static class Alerts {
        /** Window during which an unacknowledged alert suppresses a new one of the same room and type. */
        private Duration cooldown = Duration.ofMinutes(5);
        /** Degrees above target that make a reading critical. */
        private double criticalThreshold = 5.0;
        private double highTemperatureOffset = 2.0;
        private double lowTemperatureOffset = 3.0;
        private double highHumidityOffset = 15.0;
        private Duration escalationAge = Duration.ofMinutes(30);
        private Duration retention = Duration.ofDays(365);
    }

    @Getter
    @Setter
    public static class Control {
        /** Half-width of the dead band around the target temperature. */
        private double hysteresis = 1.0;
        private Duration irTimeout = Duration.ofSeconds(5);
        /** Treat a command whose IR code was never learned as sent. */
        private boolean simulateMissingIrCodes = true;
    }

    @Getter
    @Setter
    public static class Sensors {
        private Duration offlineThreshold = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Readings {
        private Duration retention = Duration.ofDays(30);
        /** Raw readings older than this are compacted into hourly aggregates. */
        private Duration aggregationAge = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class CommandLogs {
        private Duration retention = Duration.ofDays(90);
    }

    @Getter
    @Setter
    public static class Notifications {
        private int poolSize = 4;
        private int queueCapacity = 1000;
    }

    @Getter
    @Setter
    public static class Kafka {
        private String irCommandTopic = "thermoguard.ir.commands";
        private String irRecordedTopic = "thermoguard.ir.recorded";
        private String irRecordedDlqTopic = "thermoguard.ir.recorded.dlq";
    }
}
