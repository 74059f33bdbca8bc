package com.koni.thermoguard.domain.exception;

import java.util.UUID;

public class AlreadyAcknowledgedException extends ConflictException {

    public AlreadyAcknowledgedException(UUID alertId) {
        super("already_acknowledged", "Alert already acknowledged: " + alertId);
    }
}
