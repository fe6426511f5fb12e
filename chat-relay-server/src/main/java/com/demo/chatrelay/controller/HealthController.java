package com.demo.chatrelay.controller;

import com.demo.chatrelay.infrastructure.ConnectionRegistry;
import com.demo.chatrelay.service.MetricsService;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final StringRedisTemplate redisTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final ConnectionRegistry connectionRegistry;
    private final MetricsService metricsService;

    public HealthController(StringRedisTemplate redisTemplate,
                            JdbcTemplate jdbcTemplate,
                            ConnectionRegistry connectionRegistry,
                            MetricsService metricsService) {
        this.redisTemplate = redisTemplate;
        this.jdbcTemplate = jdbcTemplate;
        this.connectionRegistry = connectionRegistry;
        this.metricsService = metricsService;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");

        try {
            redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            response.put("redis", "connected");
        } catch (Exception e) {
            response.put("redis", "disconnected");
        }

        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            response.put("database", "connected");
        } catch (Exception e) {
            response.put("database", "disconnected");
        }

        response.put("connections", connectionRegistry.getConnectionCount());
        response.put("metrics", metricsService.snapshot());
        return response;
    }
}
