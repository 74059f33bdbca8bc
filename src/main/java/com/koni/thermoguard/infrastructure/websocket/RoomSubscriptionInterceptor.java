package com.koni.thermoguard.infrastructure.websocket;

import com.koni.thermoguard.domain.event.NotificationEvent;
import com.koni.thermoguard.domain.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Refuses subscriptions to room topics whose room does not exist.
 * The refusal surfaces to the client as a STOMP ERROR frame.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomSubscriptionInterceptor implements ChannelInterceptor {

    static final String ROOM_DESTINATION_PREFIX = WebSocketConfig.TOPIC_PREFIX + NotificationEvent.ROOM_TOPIC_PREFIX;

    private final RoomRepository roomRepository;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.SUBSCRIBE.equals(accessor.getCommand())) {
            return message;
        }

        String destination = accessor.getDestination();
        if (destination == null || !destination.startsWith(ROOM_DESTINATION_PREFIX)) {
            return message;
        }

        String rawRoomId = destination.substring(ROOM_DESTINATION_PREFIX.length());
        UUID roomId;
        try {
            roomId = UUID.fromString(rawRoomId);
        } catch (IllegalArgumentException e) {
            log.warn("Subscription refused, malformed room id: sessionId={}, destination={}",
                    accessor.getSessionId(), destination);
            throw new MessagingException(message, "Unknown room: " + rawRoomId);
        }

        if (!roomRepository.existsById(roomId)) {
            log.warn("Subscription refused, unknown room: sessionId={}, roomId={}", accessor.getSessionId(), roomId);
            throw new MessagingException(message, "Unknown room: " + roomId);
        }

        log.debug("Room subscription accepted: sessionId={}, roomId={}", accessor.getSessionId(), roomId);
        return message;
    }
}
