package com.demo.chatrelay.controller;

import com.demo.chatrelay.domain.BackendStatus;
import com.demo.chatrelay.domain.ChatTurn;
import com.demo.chatrelay.service.AssistantService;
import com.demo.chatrelay.service.BotChatService;
import com.demo.chatrelay.service.OllamaClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Assistant endpoints. Chat requests wait in the assistant queue; the servlet
 * thread is released while they do.
 */
@Slf4j
@RestController
@RequestMapping("/api/bot")
public class AssistantController {

    private static final int HISTORY_LIMIT = 50;

    private final AssistantService assistantService;
    private final BotChatService botChatService;
    private final OllamaClient ollamaClient;

    public AssistantController(AssistantService assistantService,
                               BotChatService botChatService,
                               OllamaClient ollamaClient) {
        this.assistantService = assistantService;
        this.botChatService = botChatService;
        this.ollamaClient = ollamaClient;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        BackendStatus backend = ollamaClient.status();
        Map<String, Object> response = new HashMap<>();
        response.put("available", backend.isAvailable());
        response.put("models", backend.getModels());
        response.put("queue", assistantService.getQueueStatus());
        return response;
    }

    /**
     * POST /api/bot/chat {userId, message, model?}
     */
    @PostMapping("/chat")
    public CompletableFuture<ResponseEntity<?>> chat(@RequestBody Map<String, String> request) {
        String userId = request.get("userId");
        String message = request.get("message");
        if (userId == null || userId.isBlank() || message == null || message.isBlank()) {
            return CompletableFuture.completedFuture(
                    ResponseEntity.badRequest().body(Map.of("error", "userId and message are required")));
        }

        return assistantService.chat(userId, message, request.get("model"))
                .<ResponseEntity<?>>thenApply(response -> ResponseEntity.ok(Map.of(
                        "response", response,
                        "queue", assistantService.getQueueStatus())))
                .exceptionally(e -> {
                    log.error("Assistant request failed: userId={}", userId, e);
                    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.of("error", "Failed to get bot response"));
                });
    }

    @GetMapping("/history/{userId}")
    public ResponseEntity<?> history(@PathVariable String userId) {
        try {
            List<ChatTurn> history = botChatService.getBotHistory(userId, HISTORY_LIMIT);
            return ResponseEntity.ok(history);
        } catch (Exception e) {
            log.error("Failed to fetch bot history: userId={}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to fetch bot history"));
        }
    }

    @DeleteMapping("/history/{userId}")
    public ResponseEntity<?> clearHistory(@PathVariable String userId) {
        try {
            long deleted = botChatService.clearBotHistory(userId);
            return ResponseEntity.ok(Map.of("success", true, "deleted", deleted));
        } catch (Exception e) {
            log.error("Failed to clear bot history: userId={}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to clear history"));
        }
    }
}
