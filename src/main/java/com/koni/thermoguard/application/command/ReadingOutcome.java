package com.koni.thermoguard.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Per-item result of a bulk submission, in request order.
 */
@Getter
@AllArgsConstructor
public class ReadingOutcome {

    private final int index;
    private final boolean accepted;
    private final UUID readingId;
    private final String errorCode;
    private final String message;

    public static ReadingOutcome accepted(int index, UUID readingId) {
        return new ReadingOutcome(index, true, readingId, null, null);
    }

    public static ReadingOutcome rejected(int index, String errorCode, String message) {
        return new ReadingOutcome(index, false, null, errorCode, message);
    }
}
