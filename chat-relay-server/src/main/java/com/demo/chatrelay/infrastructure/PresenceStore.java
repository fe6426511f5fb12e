package com.demo.chatrelay.infrastructure;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Online-user set and last-seen timestamps shared by all server instances.
 */
public interface PresenceStore {

    void add(String userId, Instant seenAt);

    void remove(String userId, Instant seenAt);

    Set<String> members();

    Optional<Instant> lastSeen(String userId);
}
