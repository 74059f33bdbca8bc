package com.koni.thermoguard.infrastructure.websocket;

import com.koni.thermoguard.domain.repository.RoomRepository;
import com.koni.thermoguard.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@UnitTest
@ExtendWith(MockitoExtension.class)
class RoomSubscriptionInterceptorTest {

    @Mock
    private RoomRepository roomRepository;

    @Mock
    private MessageChannel channel;

    @InjectMocks
    private RoomSubscriptionInterceptor interceptor;

    @Test
    void shouldAcceptSubscriptionToExistingRoom() {
        // Given
        UUID roomId = UUID.randomUUID();
        when(roomRepository.existsById(roomId)).thenReturn(true);
        Message<byte[]> message = frame(StompCommand.SUBSCRIBE, "/topic/room:" + roomId);

        // When
        Message<?> result = interceptor.preSend(message, channel);

        // Then
        assertThat(result).isSameAs(message);
    }

    @Test
    void shouldRefuseSubscriptionToUnknownRoom() {
        // Given
        UUID roomId = UUID.randomUUID();
        when(roomRepository.existsById(roomId)).thenReturn(false);
        Message<byte[]> message = frame(StompCommand.SUBSCRIBE, "/topic/room:" + roomId);

        // When/Then
        assertThatThrownBy(() -> interceptor.preSend(message, channel))
                .isInstanceOf(MessagingException.class)
                .hasMessageContaining("Unknown room");
    }

    @Test
    void shouldRefuseMalformedRoomId() {
        Message<byte[]> message = frame(StompCommand.SUBSCRIBE, "/topic/room:not-a-uuid");

        assertThatThrownBy(() -> interceptor.preSend(message, channel))
                .isInstanceOf(MessagingException.class);
        verifyNoInteractions(roomRepository);
    }

    @Test
    void shouldPassDashboardSubscriptionAndOtherFrames() {
        // Given
        Message<byte[]> dashboard = frame(StompCommand.SUBSCRIBE, "/topic/dashboard");
        Message<byte[]> send = frame(StompCommand.SEND, "/topic/room:not-a-uuid");

        // When/Then
        assertThat(interceptor.preSend(dashboard, channel)).isSameAs(dashboard);
        assertThat(interceptor.preSend(send, channel)).isSameAs(send);
        verifyNoInteractions(roomRepository);
    }

    private static Message<byte[]> frame(StompCommand command, String destination) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        accessor.setDestination(destination);
        accessor.setSessionId("session-1");
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }
}
