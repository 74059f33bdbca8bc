package com.koni.thermoguard.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Number of unacknowledged alerts, in total and per severity.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class AlertCounts {

    private final long total;
    private final long critical;
    private final long warning;
    private final long info;
}
