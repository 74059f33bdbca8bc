package com.koni.thermoguard.application.service;

import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import com.koni.thermoguard.domain.model.Reading;
import com.koni.thermoguard.domain.model.Room;
import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares a reading with its room's setpoints.
 *
 * The three temperature rules are mutually exclusive and evaluated in order (critical, high, low);
 * the humidity rule is evaluated independently. Only the dimensions present in the reading are checked.
 */
@Component
@RequiredArgsConstructor
public class ThresholdPolicy {

    private final ThermoGuardProperties properties;

    public List<ThresholdBreach> evaluate(Room room, Reading reading) {
        List<ThresholdBreach> breaches = new ArrayList<>(2);
        ThermoGuardProperties.Alerts alerts = properties.getAlerts();

        if (reading.hasTemperature()) {
            double temperature = reading.getTemperature();
            double target = room.getTargetTemperature();
            double criticalLimit = target + alerts.getCriticalThreshold();

            if (temperature > criticalLimit) {
                breaches.add(new ThresholdBreach(AlertType.HIGH_TEMP, AlertSeverity.CRITICAL,
                        format("Critical temperature: %.1f°C (limit: %.1f°C)", temperature, criticalLimit)));
            } else if (temperature > target + alerts.getHighTemperatureOffset()) {
                breaches.add(new ThresholdBreach(AlertType.HIGH_TEMP, AlertSeverity.WARNING,
                        format("High temperature: %.1f°C (setpoint: %.1f°C)", temperature, target)));
            } else if (temperature < target - alerts.getLowTemperatureOffset()) {
                breaches.add(new ThresholdBreach(AlertType.LOW_TEMP, AlertSeverity.WARNING,
                        format("Low temperature: %.1f°C (setpoint: %.1f°C)", temperature, target)));
            }
        }

        if (reading.hasHumidity()) {
            double humidity = reading.getHumidity();
            double limit = room.getTargetHumidity() + alerts.getHighHumidityOffset();
            if (humidity > limit) {
                breaches.add(new ThresholdBreach(AlertType.HIGH_HUMIDITY, AlertSeverity.WARNING,
                        format("High humidity: %.1f%% (limit: %.1f%%)", humidity, limit)));
            }
        }

        return breaches;
    }

    private static String format(String template, double value, double limit) {
        return String.format(Locale.ROOT, template, value, limit);
    }
}
