package com.demo.chatrelay.infrastructure;

import com.demo.chatrelay.domain.ChatEvent;
import com.demo.chatrelay.domain.Connection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live connections of this instance and the rooms each one has joined.
 *
 * <p>WebSocket frames and backbone callbacks arrive on different threads, so
 * every read and write of the connection and room maps happens under one lock.
 * Frames are written outside the lock; each session is wrapped in a
 * {@link ConcurrentWebSocketSessionDecorator} so concurrent emitters cannot
 * interleave on the wire.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final Map<String, Connection> connections = new HashMap<>();
    private final Map<String, Set<String>> roomMembers = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;

    public ConnectionRegistry(ObjectMapper objectMapper,
                              Clock clock,
                              @Value("${chat.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                              @Value("${chat.websocket.send-buffer-limit-bytes:524288}") int sendBufferLimitBytes) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    /**
     * Register a freshly opened session. The connection starts unauthenticated with no rooms.
     */
    public Connection register(WebSocketSession wsSession) {
        Instant now = clock.instant();
        Connection connection = Connection.builder()
                .connectionId(wsSession.getId())
                .wsSession(new ConcurrentWebSocketSessionDecorator(wsSession, sendTimeLimitMs, sendBufferLimitBytes))
                .connectedAt(now)
                .lastActivity(now)
                .build();

        lock.lock();
        try {
            connections.put(connection.getConnectionId(), connection);
            log.info("Connection registered: connectionId={}, total={}",
                    connection.getConnectionId(), connections.size());
        } finally {
            lock.unlock();
        }
        return snapshot(connection);
    }

    public enum BindResult {
        BOUND,
        ALREADY_BOUND,
        REFUSED
    }

    /**
     * Attach an identity to a connection. Binding the same identity again
     * changes nothing; a different identity is refused and the first one stays.
     */
    public BindResult bind(String connectionId, String userId, String username) {
        lock.lock();
        try {
            Connection connection = connections.get(connectionId);
            if (connection == null) {
                return BindResult.REFUSED;
            }
            if (connection.getUserId() == null) {
                connection.setUserId(userId);
                connection.setUsername(username);
                return BindResult.BOUND;
            }
            if (connection.getUserId().equals(userId)) {
                return BindResult.ALREADY_BOUND;
            }
            log.warn("Rebind refused: connectionId={}, boundUserId={}, requestedUserId={}",
                    connectionId, connection.getUserId(), userId);
            return BindResult.REFUSED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the connection was not yet in the room
     */
    public boolean join(String connectionId, String roomId) {
        lock.lock();
        try {
            Connection connection = connections.get(connectionId);
            if (connection == null || !connection.getRooms().add(roomId)) {
                return false;
            }
            roomMembers.computeIfAbsent(roomId, k -> new LinkedHashSet<>()).add(connectionId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the connection was in the room
     */
    public boolean leave(String connectionId, String roomId) {
        lock.lock();
        try {
            Connection connection = connections.get(connectionId);
            if (connection == null || !connection.getRooms().remove(roomId)) {
                return false;
            }
            removeMember(roomId, connectionId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a connection and all of its room memberships.
     *
     * @return the removed connection, or empty if it was already gone
     */
    public Optional<Connection> unregister(String connectionId) {
        lock.lock();
        try {
            Connection connection = connections.remove(connectionId);
            if (connection == null) {
                return Optional.empty();
            }
            for (String roomId : connection.getRooms()) {
                removeMember(roomId, connectionId);
            }

            log.info("Connection unregistered: connectionId={}, userId={}, duration={}s, total={}",
                    connectionId, connection.getUserId(),
                    Duration.between(connection.getConnectedAt(), clock.instant()).getSeconds(),
                    connections.size());
            return Optional.of(snapshot(connection));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Connection> find(String connectionId) {
        lock.lock();
        try {
            return Optional.ofNullable(connections.get(connectionId)).map(this::snapshot);
        } finally {
            lock.unlock();
        }
    }

    public void touch(String connectionId) {
        lock.lock();
        try {
            Connection connection = connections.get(connectionId);
            if (connection != null) {
                connection.setLastActivity(clock.instant());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Connections whose last inbound frame is older than {@code idleTimeout}.
     */
    public List<String> findIdle(Duration idleTimeout) {
        Instant threshold = clock.instant().minus(idleTimeout);
        lock.lock();
        try {
            return connections.values().stream()
                    .filter(connection -> connection.getLastActivity().isBefore(threshold))
                    .map(Connection::getConnectionId)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public int getConnectionCount() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }

    // Emission

    public boolean emitToConnection(String connectionId, ChatEvent event) {
        WebSocketSession target;
        lock.lock();
        try {
            Connection connection = connections.get(connectionId);
            target = connection != null ? connection.getWsSession() : null;
        } finally {
            lock.unlock();
        }
        if (target == null) {
            log.debug("Emit to unknown connection dropped: connectionId={}, type={}", connectionId, event.getType());
            return false;
        }
        return send(List.of(target), event) == 1;
    }

    /**
     * Deliver to every local connection joined to the room.
     *
     * @return number of connections the event was written to
     */
    public int emitToRoom(String roomId, ChatEvent event) {
        return emitToRoomExcept(roomId, null, event);
    }

    public int emitToRoomExcept(String roomId, String excludedConnectionId, ChatEvent event) {
        List<WebSocketSession> targets = new ArrayList<>();
        lock.lock();
        try {
            for (String connectionId : roomMembers.getOrDefault(roomId, Set.of())) {
                if (!Objects.equals(connectionId, excludedConnectionId)) {
                    targets.add(connections.get(connectionId).getWsSession());
                }
            }
        } finally {
            lock.unlock();
        }
        return send(targets, event);
    }

    public int broadcastAll(ChatEvent event) {
        List<WebSocketSession> targets = new ArrayList<>();
        lock.lock();
        try {
            connections.values().forEach(connection -> targets.add(connection.getWsSession()));
        } finally {
            lock.unlock();
        }
        return send(targets, event);
    }

    private int send(List<WebSocketSession> targets, ChatEvent event) {
        if (targets.isEmpty()) {
            return 0;
        }

        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event is not serializable: " + event.getType(), e);
        }

        int delivered = 0;
        for (WebSocketSession session : targets) {
            try {
                if (session.isOpen()) {
                    session.sendMessage(frame);
                    delivered++;
                } else {
                    log.debug("Skipping closed session: wsId={}, type={}", session.getId(), event.getType());
                }
            } catch (Exception e) {
                log.warn("Failed to send event: wsId={}, type={}, error={}",
                        session.getId(), event.getType(), e.getMessage());
            }
        }
        return delivered;
    }

    private void removeMember(String roomId, String connectionId) {
        Set<String> members = roomMembers.get(roomId);
        if (members != null) {
            members.remove(connectionId);
            if (members.isEmpty()) {
                roomMembers.remove(roomId);
            }
        }
    }

    private Connection snapshot(Connection connection) {
        return Connection.builder()
                .connectionId(connection.getConnectionId())
                .wsSession(connection.getWsSession())
                .userId(connection.getUserId())
                .username(connection.getUsername())
                .rooms(new LinkedHashSet<>(connection.getRooms()))
                .connectedAt(connection.getConnectedAt())
                .lastActivity(connection.getLastActivity())
                .build();
    }
}
