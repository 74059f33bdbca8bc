package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.domain.model.OperationMode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Partial update of a room's settings; absent fields keep their current value.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RoomSettingsRequest {

    private Double targetTemperature;

    private Double targetHumidity;

    private OperationMode operationMode;
}
