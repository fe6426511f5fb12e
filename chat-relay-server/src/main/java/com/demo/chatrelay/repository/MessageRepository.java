package com.demo.chatrelay.repository;

import com.demo.chatrelay.domain.MessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for chat messages. Page queries return newest first.
 */
@Repository
public interface MessageRepository extends JpaRepository<MessageEntity, String> {

    List<MessageEntity> findByConversationIdOrderByCreatedAtDesc(String conversationId, Pageable pageable);

    List<MessageEntity> findByConversationIdAndCreatedAtBeforeOrderByCreatedAtDesc(
        String conversationId, Instant before, Pageable pageable);

    Optional<MessageEntity> findFirstByConversationIdOrderByCreatedAtDesc(String conversationId);
}
