package com.demo.chatrelay.handler;

import com.demo.chatrelay.domain.Connection;
import com.demo.chatrelay.infrastructure.ConnectionRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically disconnects connections that sent nothing for longer than the
 * idle timeout, so users whose socket died without a close frame do not stay
 * online forever.
 */
@Slf4j
@Component
public class LivenessMonitor {

    private final ConnectionRegistry registry;
    private final ChatEventRouter router;
    private final Duration idleTimeout;
    private final Duration sweepInterval;
    private ScheduledExecutorService sweepExecutor;

    public LivenessMonitor(ConnectionRegistry registry,
                           ChatEventRouter router,
                           @Value("${chat.liveness.idle-timeout:5m}") Duration idleTimeout,
                           @Value("${chat.liveness.sweep-interval:30s}") Duration sweepInterval) {
        this.registry = registry;
        this.router = router;
        this.idleTimeout = idleTimeout;
        this.sweepInterval = sweepInterval;
    }

    @PostConstruct
    public void start() {
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            log.info("Liveness sweep disabled");
            return;
        }
        sweepExecutor = Executors.newSingleThreadScheduledExecutor();
        long intervalMs = sweepInterval.toMillis();
        sweepExecutor.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Liveness sweep started: idleTimeout={}, interval={}", idleTimeout, sweepInterval);
    }

    /**
     * Disconnect every idle connection once.
     *
     * @return number of connections torn down
     */
    public int sweep() {
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            return 0;
        }
        int swept = 0;
        try {
            List<String> idle = registry.findIdle(idleTimeout);
            for (String connectionId : idle) {
                Optional<WebSocketSession> session = registry.find(connectionId).map(Connection::getWsSession);
                log.warn("Connection idle, disconnecting: connectionId={}, idleTimeout={}", connectionId, idleTimeout);
                router.onDisconnect(connectionId);
                session.ifPresent(this::close);
                swept++;
            }
        } catch (Exception e) {
            log.error("Error during liveness sweep", e);
        }
        return swept;
    }

    private void close(WebSocketSession session) {
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.SESSION_NOT_RELIABLE);
            }
        } catch (Exception e) {
            log.warn("Failed to close idle session: wsId={}, error={}", session.getId(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        if (sweepExecutor == null) {
            return;
        }
        log.info("Shutting down LivenessMonitor...");
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
