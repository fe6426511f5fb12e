package com.demo.chatrelay.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Presence kept in Redis: the set {@code online_users} and one
 * {@code user:{userId}:last_seen} key per user holding epoch milliseconds.
 */
@Component
@Slf4j
public class RedissonPresenceStore implements PresenceStore {

    private static final String ONLINE_USERS_KEY = "online_users";
    private static final String LAST_SEEN_KEY = "user:{userId}:last_seen";

    private final RedissonClient redissonClient;

    public RedissonPresenceStore(RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
    }

    @Override
    public void add(String userId, Instant seenAt) {
        onlineUsers().add(userId);
        lastSeenBucket(userId).set(Long.toString(seenAt.toEpochMilli()));
    }

    @Override
    public void remove(String userId, Instant seenAt) {
        onlineUsers().remove(userId);
        lastSeenBucket(userId).set(Long.toString(seenAt.toEpochMilli()));
    }

    @Override
    public Set<String> members() {
        return new HashSet<>(onlineUsers().readAll());
    }

    @Override
    public Optional<Instant> lastSeen(String userId) {
        String value = lastSeenBucket(userId).get();
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
        } catch (NumberFormatException e) {
            log.warn("Unreadable last-seen value: userId={}, value={}", userId, value);
            return Optional.empty();
        }
    }

    private RSet<String> onlineUsers() {
        return redissonClient.getSet(ONLINE_USERS_KEY, StringCodec.INSTANCE);
    }

    private RBucket<String> lastSeenBucket(String userId) {
        return redissonClient.getBucket(LAST_SEEN_KEY.replace("{userId}", userId), StringCodec.INSTANCE);
    }
}
