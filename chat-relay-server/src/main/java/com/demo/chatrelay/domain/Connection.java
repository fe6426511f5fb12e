package com.demo.chatrelay.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A live client connection. Mutated only by {@code ConnectionRegistry} under its lock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Connection {
    private String connectionId;
    private WebSocketSession wsSession;
    private String userId;
    private String username;
    @Builder.Default
    private Set<String> rooms = new LinkedHashSet<>();
    private Instant connectedAt;
    private Instant lastActivity;

    public boolean isAuthenticated() {
        return userId != null;
    }
}
