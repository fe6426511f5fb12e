package com.demo.chatrelay.handler;

import com.demo.chatrelay.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint for chat clients. Frames of one session arrive here one at
 * a time; everything past the transport is handled by {@link ChatEventRouter}.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private final ChatEventRouter router;
    private final MetricsService metricsService;

    public ChatWebSocketHandler(ChatEventRouter router, MetricsService metricsService) {
        this.router = router;
        this.metricsService = metricsService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) {
        router.onConnect(wsSession);
        log.info("WebSocket connected: wsId={}, remote={}", wsSession.getId(), wsSession.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        log.debug("Received frame: wsId={}, length={}", wsSession.getId(), message.getPayloadLength());
        router.onFrame(wsSession.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("Transport error: wsId={}", wsSession.getId(), exception);
        metricsService.recordError("TRANSPORT_ERROR", "ChatWebSocketHandler");
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        log.info("WebSocket closed: wsId={}, status={}", wsSession.getId(), status);
        router.onDisconnect(wsSession.getId());
    }
}
