package com.demo.chatrelay.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event names of the client protocol, as they appear in the {@code type} field of a frame.
 */
public enum EventType {

    // Client → Server
    AUTHENTICATE("authenticate"),
    JOIN_CONVERSATION("join_conversation"),
    LEAVE_CONVERSATION("leave_conversation"),
    SEND_MESSAGE("send_message"),
    TYPING("typing"),
    START_DIRECT("start_direct"),
    HEARTBEAT("heartbeat"),
    PING("ping"),

    // Server → Client
    ONLINE_USERS("online_users"),
    MESSAGE_HISTORY("message_history"),
    NEW_MESSAGE("new_message"),
    USER_ONLINE("user_online"),
    USER_OFFLINE("user_offline"),
    USER_TYPING("user_typing"),
    CONVERSATION_STARTED("conversation_started"),
    HEARTBEAT_ACK("heartbeat_ack"),
    PONG("pong");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<EventType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(name))
                .findFirst();
    }

    @JsonCreator
    static EventType forJson(String name) {
        return fromWireName(name).orElse(null);
    }
}
