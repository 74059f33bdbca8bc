package com.koni.thermoguard.infrastructure.scheduling;

import com.koni.thermoguard.application.service.AlertService;
import com.koni.thermoguard.application.service.ReadingHousekeepingService;
import com.koni.thermoguard.application.service.SensorLivenessService;
import com.koni.thermoguard.application.service.SweepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic triggers for the housekeeping jobs.
 *
 * Each job is scheduled on its own; a failing run is logged and the next run happens on schedule.
 * Disabled entirely with {@code thermoguard.housekeeping.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "thermoguard.housekeeping", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class HousekeepingScheduler {

    private final SensorLivenessService sensorLivenessService;
    private final ReadingHousekeepingService readingHousekeepingService;
    private final AlertService alertService;

    @Scheduled(fixedDelayString = "${thermoguard.housekeeping.sensor-status-delay:60000}",
            initialDelayString = "${thermoguard.housekeeping.initial-delay:30000}")
    public void checkSensorStatus() {
        try {
            SweepResult result = sensorLivenessService.checkAllSensorStatus();
            if (result.getMarkedOffline() > 0 || result.getFailed() > 0) {
                log.info("Sensor status sweep: {}", result);
            }
        } catch (RuntimeException e) {
            log.error("Sensor status sweep failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${thermoguard.housekeeping.alert-escalation-delay:300000}",
            initialDelayString = "${thermoguard.housekeeping.initial-delay:30000}")
    public void escalateCriticalAlerts() {
        try {
            alertService.escalateCriticalAlerts();
        } catch (RuntimeException e) {
            log.error("Alert escalation failed", e);
        }
    }

    @Scheduled(cron = "${thermoguard.housekeeping.reading-aggregation-cron:0 5 * * * *}")
    public void aggregateReadings() {
        try {
            readingHousekeepingService.aggregateReadings();
        } catch (RuntimeException e) {
            log.error("Reading aggregation failed", e);
        }
    }

    @Scheduled(cron = "${thermoguard.housekeeping.reading-cleanup-cron:0 0 3 * * *}")
    public void cleanupOldReadings() {
        try {
            readingHousekeepingService.cleanupOldReadings();
        } catch (RuntimeException e) {
            log.error("Reading cleanup failed", e);
        }
    }

    @Scheduled(cron = "${thermoguard.housekeeping.alert-cleanup-cron:0 30 3 * * *}")
    public void cleanupOldAlerts() {
        try {
            alertService.cleanupOldAlerts();
        } catch (RuntimeException e) {
            log.error("Alert cleanup failed", e);
        }
    }

    @Scheduled(cron = "${thermoguard.housekeeping.command-log-cleanup-cron:0 0 4 * * *}")
    public void cleanupOldCommandLogs() {
        try {
            readingHousekeepingService.cleanupOldCommandLogs();
        } catch (RuntimeException e) {
            log.error("Command log cleanup failed", e);
        }
    }
}
