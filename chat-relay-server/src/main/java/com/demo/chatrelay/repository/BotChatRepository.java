package com.demo.chatrelay.repository;

import com.demo.chatrelay.domain.BotChatEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BotChatRepository extends JpaRepository<BotChatEntity, String> {

    List<BotChatEntity> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    @Transactional
    long deleteByUserId(String userId);
}
