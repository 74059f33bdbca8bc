package com.koni.thermoguard.application.port;

import com.koni.thermoguard.domain.event.NotificationEvent;

/**
 * Port interface for pushing real-time notifications to dashboard subscribers.
 * This interface follows the Hexagonal Architecture pattern, defining an output port
 * implemented by infrastructure adapters (e.g. STOMP over WebSocket).
 *
 * Delivery is fire-and-forget: implementations return without waiting for delivery and
 * never propagate a delivery failure to the caller.
 */
public interface NotificationPublisher {

    /**
     * Publishes the event to the dashboard topic and to the topic of the event's room.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     */
    void publish(NotificationEvent event);
}
