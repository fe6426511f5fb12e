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
 * Conversation Entity - Persisted in Database
 *
 * Direct conversations carry a {@code directKey} built from the unordered
 * participant pair; the unique index keeps at most one per pair.
 */
@Entity
@Table(name = "conversations", indexes = {
    @Index(name = "idx_conversation_direct_key", columnList = "directKey", unique = true),
    @Index(name = "idx_conversation_updated", columnList = "updatedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEntity implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 255)
    private String name;

    @Column(nullable = false)
    private boolean isGroup;

    @Column(length = 255, unique = true)
    private String directKey;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    /**
     * Key identifying the direct conversation between two users, independent of argument order.
     * The first id is length-prefixed, so ids containing the separator cannot collide.
     */
    public static String directKeyOf(String userId1, String userId2) {
        boolean ordered = userId1.compareTo(userId2) <= 0;
        String first = ordered ? userId1 : userId2;
        String second = ordered ? userId2 : userId1;
        return first.length() + ":" + first + ":" + second;
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
