package com.demo.chatrelay.repository;

import com.demo.chatrelay.domain.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Conversation entities
 */
@Repository
public interface ConversationRepository extends JpaRepository<ConversationEntity, String> {

    /**
     * Find the direct conversation for an unordered user pair
     */
    Optional<ConversationEntity> findByDirectKey(String directKey);

    /**
     * Find conversations a user participates in, most recently updated first
     */
    @Query("SELECT c FROM ConversationEntity c " +
           "WHERE c.id IN (SELECT p.conversationId FROM ParticipantEntity p WHERE p.userId = :userId) " +
           "ORDER BY c.updatedAt DESC")
    List<ConversationEntity> findByParticipant(@Param("userId") String userId);
}
