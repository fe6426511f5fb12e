package com.demo.chatrelay.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * A stored message with its sender's display fields, relayed to clients verbatim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageView implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String content;
    private String senderId;
    private String conversationId;
    private Instant createdAt;
    private Sender sender;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Sender implements Serializable {
        private static final long serialVersionUID = 1L;

        private String id;
        private String username;
        private String avatar;
    }
}
