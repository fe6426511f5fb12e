package com.demo.chatrelay.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One turn of a user's conversation with the assistant.
 */
@Entity
@Table(name = "bot_chats", indexes = {
    @Index(name = "idx_bot_chat_user_created", columnList = "userId,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BotChatEntity implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 36)
    private String userId;

    @Column(nullable = false, length = 20)
    private String role;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(length = 100)
    private String model;

    // JSON describing the context augmentation, null for plain chat
    @Column(columnDefinition = "TEXT")
    private String context;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
