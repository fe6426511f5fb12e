package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.MessageEntity;
import com.demo.chatrelay.domain.MessageView;
import com.demo.chatrelay.domain.UserEntity;
import com.demo.chatrelay.repository.MessageRepository;
import com.demo.chatrelay.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Message persistence and history paging.
 */
@Slf4j
@Service
public class MessageService {

    private final MessageRepository messageRepository;
    private final UserRepository userRepository;
    private final int defaultPageSize;

    public MessageService(MessageRepository messageRepository,
                          UserRepository userRepository,
                          @Value("${chat.history.page-size:50}") int defaultPageSize) {
        this.messageRepository = messageRepository;
        this.userRepository = userRepository;
        this.defaultPageSize = defaultPageSize;
    }

    /**
     * Persist a message and return it with the sender's display fields.
     */
    @Transactional
    public MessageView createMessage(String content, String senderId, String conversationId) {
        UserEntity sender = userRepository.findById(senderId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown sender: " + senderId));

        MessageEntity saved = messageRepository.save(MessageEntity.builder()
                .content(content)
                .senderId(senderId)
                .conversationId(conversationId)
                .createdAt(Instant.now())
                .build());

        log.debug("Saved message: messageId={}, conversationId={}, senderId={}",
                saved.getId(), conversationId, senderId);
        return toView(saved, sender);
    }

    public List<MessageView> getConversationMessages(String conversationId) {
        return getConversationMessages(conversationId, defaultPageSize, null);
    }

    /**
     * One page of history, oldest first. The page is the {@code limit} newest
     * messages strictly older than the {@code cursor} message, or the newest
     * overall when no cursor is given.
     */
    @Transactional(readOnly = true)
    public List<MessageView> getConversationMessages(String conversationId, int limit, String cursor) {
        PageRequest page = PageRequest.of(0, limit);
        List<MessageEntity> newestFirst;

        if (cursor != null) {
            Optional<MessageEntity> anchor = messageRepository.findById(cursor);
            if (anchor.isEmpty()) {
                log.warn("History cursor not found: conversationId={}, cursor={}", conversationId, cursor);
                return List.of();
            }
            newestFirst = messageRepository.findByConversationIdAndCreatedAtBeforeOrderByCreatedAtDesc(
                    conversationId, anchor.get().getCreatedAt(), page);
        } else {
            newestFirst = messageRepository.findByConversationIdOrderByCreatedAtDesc(conversationId, page);
        }

        List<MessageEntity> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return toViews(oldestFirst);
    }

    @Transactional(readOnly = true)
    public Optional<MessageView> getLatestMessage(String conversationId) {
        return messageRepository.findFirstByConversationIdOrderByCreatedAtDesc(conversationId)
                .map(message -> toViews(List.of(message)).get(0));
    }

    private List<MessageView> toViews(List<MessageEntity> messages) {
        Set<String> senderIds = messages.stream()
                .map(MessageEntity::getSenderId)
                .collect(Collectors.toSet());
        Map<String, UserEntity> senders = userRepository.findAllById(senderIds).stream()
                .collect(Collectors.toMap(UserEntity::getId, Function.identity()));

        return messages.stream()
                .map(message -> toView(message, senders.get(message.getSenderId())))
                .collect(Collectors.toList());
    }

    private MessageView toView(MessageEntity message, UserEntity sender) {
        MessageView.Sender senderView = sender != null
                ? MessageView.Sender.builder()
                    .id(sender.getId())
                    .username(sender.getUsername())
                    .avatar(sender.getAvatar())
                    .build()
                : MessageView.Sender.builder().id(message.getSenderId()).build();

        return MessageView.builder()
                .id(message.getId())
                .content(message.getContent())
                .senderId(message.getSenderId())
                .conversationId(message.getConversationId())
                .createdAt(message.getCreatedAt())
                .sender(senderView)
                .build();
    }
}
