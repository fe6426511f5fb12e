package com.demo.chatrelay.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Payload published on the pub/sub backbone. {@code new_message} fills
 * conversationId and message, the presence channels only userId.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackboneEnvelope {
    private String conversationId;
    private String userId;
    private MessageView message;
    private Instant timestamp;

    public static BackboneEnvelope newMessage(String conversationId, MessageView message) {
        return BackboneEnvelope.builder()
                .conversationId(conversationId)
                .message(message)
                .timestamp(Instant.now())
                .build();
    }

    public static BackboneEnvelope presence(String userId) {
        return BackboneEnvelope.builder()
                .userId(userId)
                .timestamp(Instant.now())
                .build();
    }
}
