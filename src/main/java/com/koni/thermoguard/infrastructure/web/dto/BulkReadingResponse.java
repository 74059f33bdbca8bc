package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.application.command.ReadingOutcome;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Result of a bulk submission: totals plus one outcome per submitted item, in request order.
 */
@Getter
@AllArgsConstructor
public class BulkReadingResponse {

    private final int total;
    private final long accepted;
    private final long rejected;
    private final List<ReadingOutcome> results;

    public static BulkReadingResponse of(List<ReadingOutcome> outcomes) {
        long accepted = outcomes.stream().filter(ReadingOutcome::isAccepted).count();
        return new BulkReadingResponse(outcomes.size(), accepted, outcomes.size() - accepted, outcomes);
    }
}
