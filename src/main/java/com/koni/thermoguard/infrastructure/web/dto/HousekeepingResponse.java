package com.koni.thermoguard.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Counts reported by one manually triggered housekeeping job.
 */
@Getter
@AllArgsConstructor
public class HousekeepingResponse {

    private final String job;
    private final Map<String, Number> result;
}
