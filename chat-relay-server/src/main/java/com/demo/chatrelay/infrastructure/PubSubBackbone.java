package com.demo.chatrelay.infrastructure;

import com.demo.chatrelay.domain.BackboneEnvelope;

/**
 * Broadcast medium shared by all server instances. Delivery is at-least-once
 * and ordered per channel; every subscriber, including the publishing
 * instance, receives each envelope.
 */
public interface PubSubBackbone {

    String NEW_MESSAGE = "new_message";
    String USER_ONLINE = "user_online";
    String USER_OFFLINE = "user_offline";
    // Reserved. Typing indicators stay on the instance that received them.
    String TYPING = "typing";

    void publish(String channel, BackboneEnvelope envelope);

    void subscribe(BackboneListener listener, String... channels);
}
