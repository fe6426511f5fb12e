package com.demo.chatrelay.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummary {
    private String id;
    private String name;
    private boolean group;
    private Instant updatedAt;
    private List<ParticipantView> participants;
    private MessageView lastMessage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ParticipantView {
        private String id;
        private String username;
        private String avatar;
        private boolean online;
    }
}
