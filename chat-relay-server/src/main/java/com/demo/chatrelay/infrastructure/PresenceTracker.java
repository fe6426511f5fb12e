package com.demo.chatrelay.infrastructure;

import com.demo.chatrelay.domain.BackboneEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks which users are online across all instances and announces transitions
 * on the backbone.
 *
 * <p>The shared set lives in the {@link PresenceStore}; this class keeps no
 * state of its own.
 */
@Component
@Slf4j
public class PresenceTracker {

    private final PresenceStore presenceStore;
    private final PubSubBackbone backbone;
    private final Clock clock;

    public PresenceTracker(PresenceStore presenceStore, PubSubBackbone backbone, Clock clock) {
        this.presenceStore = presenceStore;
        this.backbone = backbone;
        this.clock = clock;
    }

    public void markOnline(String userId) {
        presenceStore.add(userId, clock.instant());
        backbone.publish(PubSubBackbone.USER_ONLINE, BackboneEnvelope.presence(userId));
        log.info("User online: userId={}", userId);
    }

    /**
     * Removes the user from the shared set and publishes one {@code user_offline}.
     */
    public void markOffline(String userId) {
        Instant now = clock.instant();
        presenceStore.remove(userId, now);
        backbone.publish(PubSubBackbone.USER_OFFLINE, BackboneEnvelope.presence(userId));
        log.info("User offline: userId={}, lastSeen={}", userId, now);
    }

    public Set<String> listOnline() {
        return presenceStore.members();
    }

    public Optional<Instant> lastSeen(String userId) {
        return presenceStore.lastSeen(userId);
    }
}
