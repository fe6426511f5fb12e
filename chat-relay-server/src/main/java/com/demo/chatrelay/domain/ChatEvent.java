package com.demo.chatrelay.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Outbound frame sent to a client: {@code {"type": ..., "data": ..., "timestamp": ...}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEvent {

    private EventType type;
    private Object data;
    private Instant timestamp;

    public static ChatEvent of(EventType type, Object data) {
        return ChatEvent.builder()
            .type(type)
            .data(data)
            .timestamp(Instant.now())
            .build();
    }

    // Factory methods

    public static ChatEvent onlineUsers(Collection<String> userIds) {
        return of(EventType.ONLINE_USERS, List.copyOf(userIds));
    }

    public static ChatEvent messageHistory(String conversationId, List<MessageView> messages) {
        return of(EventType.MESSAGE_HISTORY, Map.of(
            "conversationId", conversationId,
            "messages", messages
        ));
    }

    public static ChatEvent newMessage(MessageView message) {
        return of(EventType.NEW_MESSAGE, message);
    }

    public static ChatEvent userOnline(String userId) {
        return of(EventType.USER_ONLINE, Map.of("userId", userId));
    }

    public static ChatEvent userOffline(String userId) {
        return of(EventType.USER_OFFLINE, Map.of("userId", userId));
    }

    public static ChatEvent userTyping(String conversationId, String userId, String username, boolean isTyping) {
        return of(EventType.USER_TYPING, Map.of(
            "conversationId", conversationId,
            "userId", userId,
            "username", username,
            "isTyping", isTyping
        ));
    }

    public static ChatEvent conversationStarted(String conversationId) {
        return of(EventType.CONVERSATION_STARTED, Map.of("conversationId", conversationId));
    }

    public static ChatEvent heartbeatAck() {
        return of(EventType.HEARTBEAT_ACK, null);
    }

    public static ChatEvent pong() {
        return of(EventType.PONG, null);
    }
}
