package com.koni.thermoguard.domain.model;

import lombok.EqualsAndHashCode;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Who initiated an actuation: the automatic controller or an identified user.
 * Never null; commands issued by the controller use {@link #system()}.
 */
@EqualsAndHashCode
public final class Actor {

    private static final Actor SYSTEM = new Actor(null);

    private final UUID userId;

    private Actor(UUID userId) {
        this.userId = userId;
    }

    public static Actor system() {
        return SYSTEM;
    }

    public static Actor user(UUID userId) {
        return new Actor(Objects.requireNonNull(userId, "userId cannot be null"));
    }

    public boolean isSystem() {
        return userId == null;
    }

    public Optional<UUID> getUserId() {
        return Optional.ofNullable(userId);
    }

    /**
     * Label used in broadcasts and logs: the user id, or {@code System}.
     */
    public String describe() {
        return isSystem() ? "System" : userId.toString();
    }

    @Override
    public String toString() {
        return "Actor{" + describe() + '}';
    }
}
