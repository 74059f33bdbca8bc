package com.koni.thermoguard.application.service;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one liveness sweep.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class SweepResult {

    /** Stale sensors examined. */
    private final int checked;
    /** Sensors this sweep transitioned to offline. */
    private final int markedOffline;
    private final int failed;
}
