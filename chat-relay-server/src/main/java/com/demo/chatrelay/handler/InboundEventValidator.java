package com.demo.chatrelay.handler;

import com.demo.chatrelay.domain.Connection;
import com.demo.chatrelay.domain.EventType;
import com.demo.chatrelay.domain.InboundEvent;
import com.demo.chatrelay.domain.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Checks an inbound event against the connection it arrived on: known client
 * event, required fields present, identity bound where one is needed.
 */
@Component
public class InboundEventValidator {

    private static final Set<EventType> CLIENT_EVENTS = EnumSet.of(
            EventType.AUTHENTICATE,
            EventType.JOIN_CONVERSATION,
            EventType.LEAVE_CONVERSATION,
            EventType.SEND_MESSAGE,
            EventType.TYPING,
            EventType.START_DIRECT,
            EventType.HEARTBEAT,
            EventType.PING);

    private static final Set<EventType> IDENTITY_REQUIRED = EnumSet.of(
            EventType.JOIN_CONVERSATION,
            EventType.SEND_MESSAGE,
            EventType.TYPING,
            EventType.START_DIRECT);

    public ValidationResult validate(InboundEvent event, Connection connection) {
        EventType type = event.getType();
        if (type == null || !CLIENT_EVENTS.contains(type)) {
            return ValidationResult.failure("Not a client event: " + type);
        }
        if (IDENTITY_REQUIRED.contains(type) && !connection.isAuthenticated()) {
            return ValidationResult.failure("Not authenticated");
        }

        switch (type) {
            case AUTHENTICATE:
                if (isBlank(event.text("userId")) || isBlank(event.text("username"))) {
                    return ValidationResult.failure("userId and username are required");
                }
                break;
            case JOIN_CONVERSATION:
            case LEAVE_CONVERSATION:
                if (isBlank(event.id("conversationId"))) {
                    return ValidationResult.failure("conversationId is required");
                }
                break;
            case SEND_MESSAGE:
                if (isBlank(event.text("conversationId"))) {
                    return ValidationResult.failure("conversationId is required");
                }
                if (isBlank(event.text("content"))) {
                    return ValidationResult.failure("Message content cannot be empty");
                }
                break;
            case TYPING:
                if (isBlank(event.text("conversationId"))) {
                    return ValidationResult.failure("conversationId is required");
                }
                if (event.flag("isTyping") == null) {
                    return ValidationResult.failure("isTyping must be a boolean");
                }
                break;
            case START_DIRECT:
                String target = event.id("targetUserId");
                if (isBlank(target)) {
                    return ValidationResult.failure("targetUserId is required");
                }
                if (target.equals(connection.getUserId())) {
                    return ValidationResult.failure("Cannot start a direct conversation with yourself");
                }
                break;
            default:
                break;
        }
        return ValidationResult.success();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
