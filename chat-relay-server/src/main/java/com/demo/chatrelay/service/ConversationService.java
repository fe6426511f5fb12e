package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.ConversationEntity;
import com.demo.chatrelay.domain.ConversationSummary;
import com.demo.chatrelay.domain.ParticipantEntity;
import com.demo.chatrelay.domain.UserEntity;
import com.demo.chatrelay.repository.ConversationRepository;
import com.demo.chatrelay.repository.ParticipantRepository;
import com.demo.chatrelay.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Conversation lookup and creation.
 */
@Slf4j
@Service
public class ConversationService {

    private final ConversationRepository conversationRepository;
    private final ParticipantRepository participantRepository;
    private final UserRepository userRepository;
    private final MessageService messageService;
    private final TransactionTemplate transactionTemplate;

    public ConversationService(ConversationRepository conversationRepository,
                               ParticipantRepository participantRepository,
                               UserRepository userRepository,
                               MessageService messageService,
                               TransactionTemplate transactionTemplate) {
        this.conversationRepository = conversationRepository;
        this.participantRepository = participantRepository;
        this.userRepository = userRepository;
        this.messageService = messageService;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Resolve the direct conversation between two users, creating it on first use.
     * Argument order does not matter. A concurrent creation for the same pair loses
     * on the unique direct key and falls back to the winner's conversation.
     */
    public String getOrCreateDirectConversation(String userId1, String userId2) {
        String directKey = ConversationEntity.directKeyOf(userId1, userId2);

        return conversationRepository.findByDirectKey(directKey)
                .map(ConversationEntity::getId)
                .orElseGet(() -> createDirectConversation(directKey, userId1, userId2));
    }

    private String createDirectConversation(String directKey, String userId1, String userId2) {
        try {
            String conversationId = transactionTemplate.execute(status -> {
                ConversationEntity conversation = conversationRepository.saveAndFlush(
                        ConversationEntity.builder()
                                .isGroup(false)
                                .directKey(directKey)
                                .build());
                addParticipants(conversation.getId(), new LinkedHashSet<>(List.of(userId1, userId2)));
                return conversation.getId();
            });

            log.info("Created direct conversation: conversationId={}, users={}", conversationId, directKey);
            return conversationId;

        } catch (DataIntegrityViolationException e) {
            log.info("Direct conversation created concurrently, reusing: users={}", directKey);
            return conversationRepository.findByDirectKey(directKey)
                    .map(ConversationEntity::getId)
                    .orElseThrow(() -> new IllegalStateException(
                            "Direct conversation vanished after conflict: " + directKey, e));
        }
    }

    /**
     * Create a named group conversation.
     */
    @Transactional
    public ConversationSummary createGroupConversation(String name, List<String> participantIds) {
        Set<String> distinct = new LinkedHashSet<>(participantIds);
        if (distinct.size() < 2) {
            throw new IllegalArgumentException("At least 2 participants required");
        }

        ConversationEntity conversation = conversationRepository.save(ConversationEntity.builder()
                .name(name)
                .isGroup(true)
                .build());
        addParticipants(conversation.getId(), distinct);

        log.info("Created group conversation: conversationId={}, participants={}",
                conversation.getId(), distinct.size());
        return summarize(conversation, participantRepository.findByConversationId(conversation.getId()));
    }

    /**
     * Conversations a user takes part in, most recently updated first, each with its latest message.
     */
    @Transactional(readOnly = true)
    public List<ConversationSummary> getUserConversations(String userId) {
        List<ConversationEntity> conversations = conversationRepository.findByParticipant(userId);
        if (conversations.isEmpty()) {
            return List.of();
        }

        Map<String, List<ParticipantEntity>> participantsByConversation = participantRepository
                .findByConversationIdIn(conversations.stream().map(ConversationEntity::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(ParticipantEntity::getConversationId));

        return conversations.stream()
                .map(conversation -> summarize(conversation,
                        participantsByConversation.getOrDefault(conversation.getId(), List.of())))
                .collect(Collectors.toList());
    }

    private void addParticipants(String conversationId, Set<String> userIds) {
        participantRepository.saveAll(userIds.stream()
                .map(userId -> ParticipantEntity.builder()
                        .conversationId(conversationId)
                        .userId(userId)
                        .build())
                .toList());
    }

    private ConversationSummary summarize(ConversationEntity conversation, List<ParticipantEntity> participants) {
        Map<String, UserEntity> users = userRepository
                .findAllById(participants.stream().map(ParticipantEntity::getUserId).toList())
                .stream()
                .collect(Collectors.toMap(UserEntity::getId, Function.identity()));

        List<ConversationSummary.ParticipantView> participantViews = participants.stream()
                .map(participant -> {
                    UserEntity user = users.get(participant.getUserId());
                    return ConversationSummary.ParticipantView.builder()
                            .id(participant.getUserId())
                            .username(user != null ? user.getUsername() : null)
                            .avatar(user != null ? user.getAvatar() : null)
                            .online(user != null && user.isOnline())
                            .build();
                })
                .toList();

        return ConversationSummary.builder()
                .id(conversation.getId())
                .name(conversation.getName())
                .group(conversation.isGroup())
                .updatedAt(conversation.getUpdatedAt())
                .participants(participantViews)
                .lastMessage(messageService.getLatestMessage(conversation.getId()).orElse(null))
                .build();
    }
}
