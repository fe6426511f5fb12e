package com.demo.chatrelay.handler;

import com.demo.chatrelay.domain.Connection;
import com.demo.chatrelay.domain.EventType;
import com.demo.chatrelay.domain.InboundEvent;
import com.demo.chatrelay.domain.ValidationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InboundEventValidatorTest {

    private final InboundEventValidator validator = new InboundEventValidator();
    private final ObjectMapper mapper = new ObjectMapper();

    private InboundEvent event(EventType type, String dataJson) throws Exception {
        return new InboundEvent(type, dataJson == null ? null : mapper.readTree(dataJson));
    }

    private static Connection anonymous() {
        return Connection.builder().connectionId("ws-1").build();
    }

    private static Connection authenticated(String userId) {
        return Connection.builder().connectionId("ws-1").userId(userId).username(userId).build();
    }

    @Test
    void shouldRequireUserIdAndUsernameToAuthenticate() throws Exception {
        assertTrue(validator.validate(event(EventType.AUTHENTICATE,
                "{\"userId\":\"u1\",\"username\":\"Alice\"}"), anonymous()).isValid());
        assertFalse(validator.validate(event(EventType.AUTHENTICATE,
                "{\"userId\":\"u1\"}"), anonymous()).isValid());
        assertFalse(validator.validate(event(EventType.AUTHENTICATE,
                "{\"userId\":\"\",\"username\":\"Alice\"}"), anonymous()).isValid());
    }

    @Test
    void shouldRequireIdentityForRoomAndMessageEvents() throws Exception {
        ValidationResult result = validator.validate(event(EventType.JOIN_CONVERSATION, "\"c1\""), anonymous());

        assertFalse(result.isValid());
        assertEquals("Not authenticated", result.getErrorMessage());
    }

    @Test
    void shouldAllowLeaveAndHeartbeatWithoutIdentity() throws Exception {
        assertTrue(validator.validate(event(EventType.LEAVE_CONVERSATION, "\"c1\""), anonymous()).isValid());
        assertTrue(validator.validate(event(EventType.HEARTBEAT, null), anonymous()).isValid());
    }

    @Test
    void shouldRejectBlankMessageContent() throws Exception {
        ValidationResult result = validator.validate(event(EventType.SEND_MESSAGE,
                "{\"conversationId\":\"c1\",\"content\":\"  \"}"), authenticated("u1"));

        assertFalse(result.isValid());
        assertEquals("Message content cannot be empty", result.getErrorMessage());
    }

    @Test
    void shouldRequireBooleanTypingFlag() throws Exception {
        assertTrue(validator.validate(event(EventType.TYPING,
                "{\"conversationId\":\"c1\",\"isTyping\":false}"), authenticated("u1")).isValid());
        assertFalse(validator.validate(event(EventType.TYPING,
                "{\"conversationId\":\"c1\",\"isTyping\":\"yes\"}"), authenticated("u1")).isValid());
    }

    @Test
    void shouldRejectDirectConversationWithSelf() throws Exception {
        assertFalse(validator.validate(event(EventType.START_DIRECT, "\"u1\""), authenticated("u1")).isValid());
        assertTrue(validator.validate(event(EventType.START_DIRECT,
                "{\"targetUserId\":\"u2\"}"), authenticated("u1")).isValid());
    }

    @Test
    void shouldRejectServerEventsSentByClient() throws Exception {
        assertFalse(validator.validate(event(EventType.NEW_MESSAGE, "{}"), authenticated("u1")).isValid());
    }
}
