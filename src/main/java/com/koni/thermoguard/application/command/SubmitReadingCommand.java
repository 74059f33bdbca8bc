package com.koni.thermoguard.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Command to ingest one sensor reading.
 */
@Getter
@AllArgsConstructor
@ToString
public class SubmitReadingCommand {

    /**
     * The sensor's device id, or its internal id in string form.
     */
    private final String identifier;

    private final Double temperature;

    private final Double humidity;

    /**
     * When the sample was taken; the ingestion time is used when absent.
     */
    private final Instant timestamp;
}
