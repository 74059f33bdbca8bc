package com.koni.thermoguard.infrastructure.websocket;

import com.koni.thermoguard.application.port.NotificationPublisher;
import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.infrastructure.observability.ThermoGuardMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * STOMP implementation of the NotificationPublisher port.
 *
 * Delivery runs on the notification executor; the caller only pays for the hand-off.
 * A full queue drops the event, and a failure on one topic does not prevent delivery to the other.
 */
@Slf4j
@Component
public class StompNotificationPublisher implements NotificationPublisher {

    private final SimpMessageSendingOperations messagingTemplate;
    private final Executor notificationExecutor;
    private final ThermoGuardMetrics metrics;

    public StompNotificationPublisher(
            SimpMessageSendingOperations messagingTemplate,
            @Qualifier("notificationExecutor") Executor notificationExecutor,
            ThermoGuardMetrics metrics) {
        this.messagingTemplate = messagingTemplate;
        this.notificationExecutor = notificationExecutor;
        this.metrics = metrics;
    }

    @Override
    public void publish(NotificationEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        try {
            notificationExecutor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Notification dropped, executor saturated: type={}, roomId={}",
                    event.getKind().code(), event.getRoomId());
            metrics.recordBroadcastFailure();
        }
    }

    void deliver(NotificationEvent event) {
        Map<String, Object> body = event.toMessage();
        for (String topic : event.topics()) {
            try {
                messagingTemplate.convertAndSend(WebSocketConfig.TOPIC_PREFIX + topic, body);
                log.debug("Notification sent: topic={}, type={}", topic, event.getKind().code());
            } catch (RuntimeException e) {
                log.warn("Notification delivery failed: topic={}, type={}, error={}",
                        topic, event.getKind().code(), e.getMessage());
                metrics.recordBroadcastFailure();
            }
        }
    }
}
