package com.koni.thermoguard.infrastructure.web.controller;

import com.koni.thermoguard.application.service.AlertService;
import com.koni.thermoguard.application.service.ReadingHousekeepingService;
import com.koni.thermoguard.application.service.SensorLivenessService;
import com.koni.thermoguard.application.service.SweepResult;
import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.infrastructure.web.dto.HousekeepingResponse;
import com.koni.thermoguard.infrastructure.web.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admin endpoint that runs one housekeeping job synchronously.
 *
 * Jobs: sensor-status, reading-cleanup, reading-aggregation, alert-cleanup, alert-escalation,
 * command-log-cleanup.
 */
@RestController
@RequestMapping("/api/v1/admin/housekeeping")
@RequiredArgsConstructor
@Slf4j
public class HousekeepingController {

    private final SensorLivenessService sensorLivenessService;
    private final ReadingHousekeepingService readingHousekeepingService;
    private final AlertService alertService;

    @PostMapping("/{job}")
    public ResponseEntity<HousekeepingResponse> run(
            @PathVariable String job,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role) {
        Caller.fromHeaders(userId, role).requireAdmin();
        log.info("Housekeeping job triggered manually: job={}, userId={}", job, userId);

        Map<String, Number> result = new LinkedHashMap<>();
        switch (job) {
            case "sensor-status":
                SweepResult sweep = sensorLivenessService.checkAllSensorStatus();
                result.put("checked", sweep.getChecked());
                result.put("markedOffline", sweep.getMarkedOffline());
                result.put("failed", sweep.getFailed());
                break;
            case "reading-cleanup":
                result.put("deleted", readingHousekeepingService.cleanupOldReadings());
                break;
            case "reading-aggregation":
                result.put("aggregatedHours", readingHousekeepingService.aggregateReadings());
                break;
            case "alert-cleanup":
                result.put("deleted", alertService.cleanupOldAlerts());
                break;
            case "alert-escalation":
                result.put("escalated", alertService.escalateCriticalAlerts());
                break;
            case "command-log-cleanup":
                result.put("deleted", readingHousekeepingService.cleanupOldCommandLogs());
                break;
            default:
                throw new NotFoundException("Unknown housekeeping job: " + job);
        }
        return ResponseEntity.ok(new HousekeepingResponse(job, result));
    }
}
