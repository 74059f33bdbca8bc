package com.koni.thermoguard.infrastructure.web.controller;

import com.koni.thermoguard.application.service.AlertService;
import com.koni.thermoguard.domain.model.Alert;
import com.koni.thermoguard.domain.model.AlertCounts;
import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.infrastructure.web.dto.AlertResponse;
import com.koni.thermoguard.infrastructure.web.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for alerts.
 *
 * Endpoints:
 * - GET /api/v1/alerts: unacknowledged alerts, newest first
 * - GET /api/v1/alerts/summary: unacknowledged counts per severity
 * - PATCH /api/v1/alerts/{alertId}/acknowledge: acknowledge one alert
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertService alertService;

    @GetMapping("/v1/alerts")
    public ResponseEntity<List<AlertResponse>> getActiveAlerts(
            @RequestParam(required = false) UUID roomId,
            @RequestParam(required = false) String severity) {
        AlertSeverity filter = severity == null ? null : AlertSeverity.fromCode(severity);
        List<AlertResponse> alerts = alertService.getActiveAlerts(roomId, filter).stream()
                .map(AlertResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(alerts);
    }

    @GetMapping("/v1/alerts/summary")
    public ResponseEntity<AlertCounts> getSummary(@RequestParam(required = false) UUID roomId) {
        return ResponseEntity.ok(alertService.getActiveAlertsCount(roomId));
    }

    /**
     * Any identified user may acknowledge.
     *
     * @return 200 OK with the acknowledged alert, 409 if it was already acknowledged
     */
    @PatchMapping("/v1/alerts/{alertId}/acknowledge")
    public ResponseEntity<AlertResponse> acknowledge(
            @PathVariable UUID alertId,
            @RequestHeader(value = Caller.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = Caller.ROLE_HEADER, required = false) String role) {
        UUID user = Caller.fromHeaders(userId, role).requireUser();
        Alert alert = alertService.acknowledge(alertId, user);
        log.info("Alert acknowledged via API: alertId={}, userId={}", alertId, user);
        return ResponseEntity.ok(AlertResponse.from(alert));
    }
}
