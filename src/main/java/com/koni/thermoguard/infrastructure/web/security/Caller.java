package com.koni.thermoguard.infrastructure.web.security;

import com.koni.thermoguard.domain.exception.ForbiddenException;
import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.domain.model.Actor;

import java.util.Optional;
import java.util.UUID;

/**
 * Identity of the HTTP caller, taken from the headers set by the authentication proxy.
 * Authorization checks throw {@link ForbiddenException} before any service is called.
 */
public final class Caller {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    private final UUID userId;
    private final CallerRole role;

    private Caller(UUID userId, CallerRole role) {
        this.userId = userId;
        this.role = role;
    }

    /**
     * @throws ValidationException if the user id header is present but not a UUID
     */
    public static Caller fromHeaders(String userIdHeader, String roleHeader) {
        UUID userId = null;
        if (userIdHeader != null && !userIdHeader.isBlank()) {
            try {
                userId = UUID.fromString(userIdHeader.trim());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid " + USER_ID_HEADER + " header: " + userIdHeader);
            }
        }
        return new Caller(userId, CallerRole.fromHeader(roleHeader).orElse(null));
    }

    public Optional<UUID> getUserId() {
        return Optional.ofNullable(userId);
    }

    public Optional<CallerRole> getRole() {
        return Optional.ofNullable(role);
    }

    /**
     * Requires an identified caller.
     */
    public UUID requireUser() {
        if (userId == null) {
            throw new ForbiddenException("Authenticated user required");
        }
        return userId;
    }

    /**
     * Requires an identified admin or operator and returns the actor to record on commands.
     */
    public Actor requireDeviceControl() {
        UUID id = requireUser();
        if (role == null || !role.canControlDevices()) {
            throw new ForbiddenException("User is not allowed to control devices");
        }
        return Actor.user(id);
    }

    public void requireAdmin() {
        requireUser();
        if (role != CallerRole.ADMIN) {
            throw new ForbiddenException("Admin role required");
        }
    }
}
