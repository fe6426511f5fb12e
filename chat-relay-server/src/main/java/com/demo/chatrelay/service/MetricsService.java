package com.demo.chatrelay.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-only metrics: in-memory counters and gauges, reported through the log.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    // ===== Counter Metrics =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    // ===== Timer Metrics =====

    public void recordTimer(String name, Duration duration) {
        log.debug("[METRIC] Timer: {} = {}ms", name, duration.toMillis());
    }

    // ===== Gauge Metrics =====

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Business Metrics =====

    public void recordConnection(String connectionId) {
        incrementCounter("websocket.connections");
        incrementGauge("active_connections");
        log.info("WebSocket connection: connectionId={}", connectionId);
    }

    public void recordDisconnection(String connectionId) {
        incrementCounter("websocket.disconnections");
        decrementGauge("active_connections");
        log.info("WebSocket disconnection: connectionId={}", connectionId);
    }

    public void recordEventReceived(String eventType) {
        incrementCounter("websocket.events.received");
        incrementCounter("websocket.events.received." + eventType);
    }

    public void recordEventDropped(String eventType, String reason) {
        incrementCounter("websocket.events.dropped");
        log.debug("Event dropped: type={}, reason={}", eventType, reason);
    }

    public void recordMessageRelayed(int recipients) {
        incrementCounter("chat.messages.relayed");
        log.debug("[METRIC] Relay fan-out: recipients={}", recipients);
    }

    public void recordAssistantRequest(Duration duration, boolean backendFailed) {
        incrementCounter(backendFailed ? "assistant.requests.failed" : "assistant.requests.completed");
        recordTimer("assistant.request.duration", duration);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors");
        log.error("Error: type={}, component={}", errorType, component);
    }

    // ===== Utility Methods =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    /**
     * Snapshot of all counters, sorted by name
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> values = new TreeMap<>();
        counters.forEach((name, value) -> values.put(name, value.get()));
        return values;
    }
}
