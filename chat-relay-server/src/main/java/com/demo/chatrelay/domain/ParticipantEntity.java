package com.demo.chatrelay.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "conversation_participants",
       uniqueConstraints = @UniqueConstraint(name = "uk_participant", columnNames = {"conversationId", "userId"}),
       indexes = @Index(name = "idx_participant_user", columnList = "userId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantEntity implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 36)
    private String conversationId;

    @Column(nullable = false, length = 36)
    private String userId;

    @Column(nullable = false)
    private Instant joinedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        joinedAt = Instant.now();
    }
}
