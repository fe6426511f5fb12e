package com.demo.chatrelay.controller;

import com.demo.chatrelay.domain.ConversationSummary;
import com.demo.chatrelay.service.ConversationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<?> getUserConversations(@PathVariable String userId) {
        try {
            List<ConversationSummary> conversations = conversationService.getUserConversations(userId);
            return ResponseEntity.ok(conversations);
        } catch (Exception e) {
            log.error("Failed to fetch conversations: userId={}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to fetch conversations"));
        }
    }

    /**
     * Create a group conversation.
     * POST /api/conversations {name, participantIds}
     */
    @PostMapping
    public ResponseEntity<?> createGroup(@RequestBody GroupRequest request) {
        if (request.participantIds() == null || request.participantIds().size() < 2) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least 2 participants required"));
        }

        try {
            ConversationSummary created = conversationService.createGroupConversation(
                    request.name(), request.participantIds());
            return ResponseEntity.ok(created);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to create group conversation: name={}", request.name(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to create conversation"));
        }
    }

    public record GroupRequest(String name, List<String> participantIds) {
    }
}
