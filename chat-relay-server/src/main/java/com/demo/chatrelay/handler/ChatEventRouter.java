package com.demo.chatrelay.handler;

import com.demo.chatrelay.domain.BackboneEnvelope;
import com.demo.chatrelay.domain.ChatEvent;
import com.demo.chatrelay.domain.Connection;
import com.demo.chatrelay.domain.EventType;
import com.demo.chatrelay.domain.InboundEvent;
import com.demo.chatrelay.domain.MessageView;
import com.demo.chatrelay.domain.ValidationResult;
import com.demo.chatrelay.infrastructure.BackboneListener;
import com.demo.chatrelay.infrastructure.ConnectionRegistry;
import com.demo.chatrelay.infrastructure.PresenceTracker;
import com.demo.chatrelay.infrastructure.PubSubBackbone;
import com.demo.chatrelay.service.ConversationService;
import com.demo.chatrelay.service.MessageService;
import com.demo.chatrelay.service.MetricsService;
import com.demo.chatrelay.service.UserService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.Optional;

/**
 * Client protocol state machine and backbone fan-out.
 *
 * <p>Inbound frames are validated, applied to the registry and persistence,
 * and answered. Events every instance must see (new messages, presence) go
 * through the backbone and are delivered to local connections when they
 * come back in {@link #onMessage}.
 */
@Component
@Slf4j
public class ChatEventRouter implements BackboneListener {

    private final ObjectMapper objectMapper;
    private final ConnectionRegistry registry;
    private final PresenceTracker presenceTracker;
    private final PubSubBackbone backbone;
    private final InboundEventValidator validator;
    private final UserService userService;
    private final MessageService messageService;
    private final ConversationService conversationService;
    private final MetricsService metricsService;

    public ChatEventRouter(ObjectMapper objectMapper,
                           ConnectionRegistry registry,
                           PresenceTracker presenceTracker,
                           PubSubBackbone backbone,
                           InboundEventValidator validator,
                           UserService userService,
                           MessageService messageService,
                           ConversationService conversationService,
                           MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.presenceTracker = presenceTracker;
        this.backbone = backbone;
        this.validator = validator;
        this.userService = userService;
        this.messageService = messageService;
        this.conversationService = conversationService;
        this.metricsService = metricsService;
    }

    @PostConstruct
    public void start() {
        backbone.subscribe(this,
                PubSubBackbone.NEW_MESSAGE,
                PubSubBackbone.USER_ONLINE,
                PubSubBackbone.USER_OFFLINE);
    }

    // ===== Connection lifecycle =====

    public Connection onConnect(WebSocketSession wsSession) {
        Connection connection = registry.register(wsSession);
        metricsService.recordConnection(connection.getConnectionId());
        return connection;
    }

    /**
     * Tear down a connection. Safe to call more than once for the same id;
     * only the first call has any effect.
     */
    public void onDisconnect(String connectionId) {
        Optional<Connection> removed = registry.unregister(connectionId);
        if (removed.isEmpty()) {
            return;
        }

        metricsService.recordDisconnection(connectionId);
        Connection connection = removed.get();
        if (!connection.isAuthenticated()) {
            return;
        }

        goOffline(connectionId, connection.getUserId());
    }

    private void goOffline(String connectionId, String userId) {
        try {
            userService.setUserOffline(userId);
        } catch (Exception e) {
            log.error("Failed to persist offline status: connectionId={}, userId={}", connectionId, userId, e);
            metricsService.recordError("PRESENCE_PERSIST_ERROR", "ChatEventRouter");
        }
        try {
            presenceTracker.markOffline(userId);
        } catch (Exception e) {
            log.error("Failed to publish offline status: connectionId={}, userId={}", connectionId, userId, e);
            metricsService.recordError("PRESENCE_PUBLISH_ERROR", "ChatEventRouter");
        }
    }

    // ===== Inbound frames =====

    public void onFrame(String connectionId, String payload) {
        registry.touch(connectionId);

        Optional<InboundEvent> parsed = parse(payload);
        if (parsed.isEmpty()) {
            metricsService.recordEventDropped("unknown", "malformed frame");
            log.debug("Malformed frame dropped: connectionId={}", connectionId);
            return;
        }
        InboundEvent event = parsed.get();

        Optional<Connection> connection = registry.find(connectionId);
        if (connection.isEmpty()) {
            log.debug("Frame for unknown connection dropped: connectionId={}", connectionId);
            return;
        }

        ValidationResult validation = validator.validate(event, connection.get());
        if (!validation.isValid()) {
            metricsService.recordEventDropped(String.valueOf(event.getType()), validation.getErrorMessage());
            log.warn("Event dropped: connectionId={}, type={}, reason={}",
                    connectionId, event.getType(), validation.getErrorMessage());
            return;
        }

        metricsService.recordEventReceived(event.getType().getWireName());
        try {
            dispatch(connection.get(), event);
        } catch (Exception e) {
            log.error("Error handling event: connectionId={}, type={}", connectionId, event.getType(), e);
            metricsService.recordError("EVENT_PROCESSING_ERROR", "ChatEventRouter");
        }
    }

    private void dispatch(Connection connection, InboundEvent event) {
        switch (event.getType()) {
            case AUTHENTICATE:
                handleAuthenticate(connection, event.text("userId"), event.text("username"));
                break;
            case JOIN_CONVERSATION:
                handleJoin(connection, event.id("conversationId"));
                break;
            case LEAVE_CONVERSATION:
                registry.leave(connection.getConnectionId(), event.id("conversationId"));
                break;
            case SEND_MESSAGE:
                handleSendMessage(connection, event.text("conversationId"), event.text("content"));
                break;
            case TYPING:
                handleTyping(connection, event.text("conversationId"), event.flag("isTyping"));
                break;
            case START_DIRECT:
                handleStartDirect(connection, event.id("targetUserId"));
                break;
            case HEARTBEAT:
                registry.emitToConnection(connection.getConnectionId(), ChatEvent.heartbeatAck());
                break;
            case PING:
                registry.emitToConnection(connection.getConnectionId(), ChatEvent.pong());
                break;
            default:
                log.warn("Unhandled event type: {}", event.getType());
        }
    }

    private void handleAuthenticate(Connection connection, String userId, String username) {
        String connectionId = connection.getConnectionId();
        ConnectionRegistry.BindResult bound = registry.bind(connectionId, userId, username);
        if (bound == ConnectionRegistry.BindResult.REFUSED) {
            metricsService.recordEventDropped(EventType.AUTHENTICATE.getWireName(), "identity already bound");
            return;
        }
        if (bound == ConnectionRegistry.BindResult.ALREADY_BOUND) {
            registry.emitToConnection(connectionId, ChatEvent.onlineUsers(presenceTracker.listOnline()));
            return;
        }

        userService.setUserOnline(userId);
        presenceTracker.markOnline(userId);

        // Closed meanwhile: its user_offline may have gone out before our user_online
        if (registry.find(connectionId).isEmpty()) {
            log.info("Connection closed during authentication: connectionId={}, userId={}", connectionId, userId);
            goOffline(connectionId, userId);
            return;
        }
        registry.emitToConnection(connectionId, ChatEvent.onlineUsers(presenceTracker.listOnline()));

        log.info("User authenticated: connectionId={}, userId={}, username={}", connectionId, userId, username);
    }

    private void handleJoin(Connection connection, String conversationId) {
        registry.join(connection.getConnectionId(), conversationId);
        List<MessageView> history = messageService.getConversationMessages(conversationId);
        registry.emitToConnection(connection.getConnectionId(), ChatEvent.messageHistory(conversationId, history));

        log.debug("Joined conversation: connectionId={}, conversationId={}, history={}",
                connection.getConnectionId(), conversationId, history.size());
    }

    private void handleSendMessage(Connection connection, String conversationId, String content) {
        MessageView message = messageService.createMessage(content, connection.getUserId(), conversationId);
        backbone.publish(PubSubBackbone.NEW_MESSAGE, BackboneEnvelope.newMessage(conversationId, message));
    }

    private void handleTyping(Connection connection, String conversationId, boolean isTyping) {
        registry.emitToRoomExcept(conversationId, connection.getConnectionId(),
                ChatEvent.userTyping(conversationId, connection.getUserId(), connection.getUsername(), isTyping));
    }

    private void handleStartDirect(Connection connection, String targetUserId) {
        String conversationId = conversationService.getOrCreateDirectConversation(connection.getUserId(), targetUserId);
        registry.emitToConnection(connection.getConnectionId(), ChatEvent.conversationStarted(conversationId));
    }

    private Optional<InboundEvent> parse(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root == null || !root.isObject() || !root.path("type").isTextual()) {
                return Optional.empty();
            }
            return EventType.fromWireName(root.get("type").asText())
                    .map(type -> new InboundEvent(type, root.get("data")));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    // ===== Backbone =====

    @Override
    public void onMessage(String channel, BackboneEnvelope envelope) {
        switch (channel) {
            case PubSubBackbone.NEW_MESSAGE:
                int recipients = registry.emitToRoom(envelope.getConversationId(), ChatEvent.newMessage(envelope.getMessage()));
                metricsService.recordMessageRelayed(recipients);
                break;
            case PubSubBackbone.USER_ONLINE:
                registry.broadcastAll(ChatEvent.userOnline(envelope.getUserId()));
                break;
            case PubSubBackbone.USER_OFFLINE:
                registry.broadcastAll(ChatEvent.userOffline(envelope.getUserId()));
                break;
            default:
                log.warn("Message on unexpected channel ignored: {}", channel);
        }
    }
}
