package com.demo.chatrelay.infrastructure;

import com.demo.chatrelay.domain.BackboneEnvelope;

/**
 * Listener interface for backbone events
 */
public interface BackboneListener {
    void onMessage(String channel, BackboneEnvelope envelope);
}
