package com.demo.chatrelay.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup unless Redis and the database both answer.
 */
@Slf4j
@Component
public class StartupVerifier implements ApplicationRunner {

    private final StringRedisTemplate redisTemplate;
    private final JdbcTemplate jdbcTemplate;

    public StartupVerifier(StringRedisTemplate redisTemplate, JdbcTemplate jdbcTemplate) {
        this.redisTemplate = redisTemplate;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            log.info("Redis reachable: reply={}", pong);
        } catch (Exception e) {
            throw new IllegalStateException("Redis is not reachable", e);
        }

        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            log.info("Database reachable");
        } catch (Exception e) {
            throw new IllegalStateException("Database is not reachable", e);
        }
    }
}
