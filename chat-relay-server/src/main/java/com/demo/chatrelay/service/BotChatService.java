package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.BotChatEntity;
import com.demo.chatrelay.domain.ChatTurn;
import com.demo.chatrelay.repository.BotChatRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stored exchanges between users and the assistant.
 */
@Slf4j
@Service
public class BotChatService {

    private final BotChatRepository botChatRepository;

    public BotChatService(BotChatRepository botChatRepository) {
        this.botChatRepository = botChatRepository;
    }

    /**
     * The user's last {@code limit} turns, oldest first.
     */
    public List<ChatTurn> getBotHistory(String userId, int limit) {
        List<BotChatEntity> newestFirst = botChatRepository.findByUserIdOrderByCreatedAtDesc(
                userId, PageRequest.of(0, limit));

        List<ChatTurn> turns = new ArrayList<>(newestFirst.size());
        for (BotChatEntity entry : newestFirst) {
            turns.add(ChatTurn.of(entry.getRole(), entry.getContent()));
        }
        Collections.reverse(turns);
        return turns;
    }

    public BotChatEntity saveBotMessage(String userId, String role, String content, String model, String context) {
        BotChatEntity saved = botChatRepository.save(BotChatEntity.builder()
                .userId(userId)
                .role(role)
                .content(content)
                .model(model)
                .context(context)
                .build());
        log.debug("Saved bot message: userId={}, role={}, withContext={}", userId, role, context != null);
        return saved;
    }

    public long clearBotHistory(String userId) {
        long deleted = botChatRepository.deleteByUserId(userId);
        log.info("Cleared bot history: userId={}, deleted={}", userId, deleted);
        return deleted;
    }
}
