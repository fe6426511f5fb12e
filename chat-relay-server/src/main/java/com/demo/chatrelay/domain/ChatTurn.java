package com.demo.chatrelay.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Role-tagged turn exchanged with the language model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurn {
    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private String role;
    private String content;

    public static ChatTurn of(String role, String content) {
        return new ChatTurn(role, content);
    }
}
