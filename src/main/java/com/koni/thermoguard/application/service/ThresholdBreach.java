package com.koni.thermoguard.application.service;

import com.koni.thermoguard.domain.model.AlertSeverity;
import com.koni.thermoguard.domain.model.AlertType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A setpoint violation detected in a reading, not yet subject to cooldown.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ThresholdBreach {

    private final AlertType type;
    private final AlertSeverity severity;
    private final String message;
}
