package com.koni.thermoguard.infrastructure.web.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Roles assigned by the upstream authentication layer.
 */
public enum CallerRole {
    ADMIN,
    OPERATOR,
    VIEWER;

    /**
     * Parses the {@code X-User-Role} header value; unknown or blank values yield empty.
     */
    public static Optional<CallerRole> fromHeader(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(CallerRole.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean canControlDevices() {
        return this == ADMIN || this == OPERATOR;
    }
}
