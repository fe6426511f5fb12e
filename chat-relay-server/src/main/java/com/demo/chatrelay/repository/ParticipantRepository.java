package com.demo.chatrelay.repository;

import com.demo.chatrelay.domain.ParticipantEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ParticipantRepository extends JpaRepository<ParticipantEntity, String> {

    List<ParticipantEntity> findByConversationId(String conversationId);

    List<ParticipantEntity> findByConversationIdIn(Collection<String> conversationIds);
}
