package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.AssistantRequest;
import com.demo.chatrelay.domain.ChatTurn;
import com.demo.chatrelay.domain.QueryIntent;
import com.demo.chatrelay.domain.QueueStatus;
import com.demo.chatrelay.infrastructure.BoundedRequestDispatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Assistant conversations, admitted through a bounded dispatcher so that at
 * most {@code assistant.max-concurrent} requests reach Ollama at once.
 */
@Slf4j
@Service
public class AssistantService {

    static final String UNREACHABLE_REPLY =
            "I'm having trouble connecting to my brain (Ollama). Make sure Ollama is running!";
    static final String ERROR_REPLY_PREFIX = "Sorry, I encountered an error: ";

    private static final String BASE_PROMPT =
            "You are Relay Assistant, an AI helper for the Relay Chat app. You are friendly, helpful, and concise.";
    private static final String GENERAL_PROMPT_SUFFIX =
            " Keep responses short and conversational unless the user asks for detailed information.";

    private final UserContextService userContextService;
    private final BotChatService botChatService;
    private final OllamaClient ollamaClient;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final String defaultModel;
    private final int historyWindow;
    private final BoundedRequestDispatcher<AssistantRequest, String> dispatcher;

    public AssistantService(UserContextService userContextService,
                            BotChatService botChatService,
                            OllamaClient ollamaClient,
                            MetricsService metricsService,
                            ObjectMapper objectMapper,
                            @Value("${ollama.model:gemma3:1b}") String defaultModel,
                            @Value("${assistant.max-concurrent:5}") int maxConcurrent,
                            @Value("${assistant.history-window:6}") int historyWindow) {
        this.userContextService = userContextService;
        this.botChatService = botChatService;
        this.ollamaClient = ollamaClient;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.defaultModel = defaultModel;
        this.historyWindow = historyWindow;
        this.dispatcher = new BoundedRequestDispatcher<>("assistant", maxConcurrent, this::execute);
    }

    /**
     * Queue a prompt for the assistant. The future completes with the reply,
     * or with an apology text when Ollama fails. Persistence errors complete it
     * exceptionally.
     */
    public CompletableFuture<String> chat(String userId, String message, String model) {
        if (userId == null || userId.isBlank() || message == null || message.isBlank()) {
            throw new IllegalArgumentException("userId and message are required");
        }
        String effectiveModel = model == null || model.isBlank() ? defaultModel : model;
        return dispatcher.submit(new AssistantRequest(userId, message, effectiveModel));
    }

    public QueueStatus getQueueStatus() {
        return dispatcher.status();
    }

    String execute(AssistantRequest request) {
        Instant start = Instant.now();
        String userId = request.getUserId();

        QueryIntent intent = userContextService.analyzeQueryIntent(request.getMessage());
        String userContext = intent.isDataQuery() ? userContextService.getUserContext(userId) : "";

        List<ChatTurn> history = botChatService.getBotHistory(userId, historyWindow);
        botChatService.saveBotMessage(userId, ChatTurn.USER, request.getMessage(), request.getModel(), null);

        List<ChatTurn> messages = new ArrayList<>(history.size() + 2);
        messages.add(ChatTurn.of(ChatTurn.SYSTEM, systemPrompt(intent, userContext)));
        messages.addAll(history);
        messages.add(ChatTurn.of(ChatTurn.USER, request.getMessage()));

        String reply;
        try {
            reply = ollamaClient.chat(request.getModel(), messages);
        } catch (AssistantBackendException e) {
            log.error("Ollama request failed: userId={}, model={}, unreachable={}, error={}",
                    userId, request.getModel(), e.isUnreachable(), e.getMessage());
            metricsService.recordAssistantRequest(Duration.between(start, Instant.now()), true);
            return e.isUnreachable() ? UNREACHABLE_REPLY : ERROR_REPLY_PREFIX + e.getMessage();
        }

        botChatService.saveBotMessage(userId, ChatTurn.ASSISTANT, reply, request.getModel(),
                intent.isDataQuery() ? contextJson(intent) : null);

        Duration elapsed = Duration.between(start, Instant.now());
        metricsService.recordAssistantRequest(elapsed, false);
        log.info("Assistant replied: userId={}, model={}, dataQuery={}, duration={}ms",
                userId, request.getModel(), intent.isDataQuery(), elapsed.toMillis());
        return reply;
    }

    private String systemPrompt(QueryIntent intent, String userContext) {
        if (intent.isDataQuery() && !userContext.isEmpty()) {
            return BASE_PROMPT
                    + "\n\nYou have access to the user's data from the database. When they ask about their"
                    + " projects, tasks, or profile, use this information to give accurate answers:\n"
                    + userContext
                    + "\n\nIMPORTANT: Base your answers on the actual data provided above."
                    + " Be specific about project names, statuses, deadlines, and task details.";
        }
        return BASE_PROMPT + GENERAL_PROMPT_SUFFIX;
    }

    private String contextJson(QueryIntent intent) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("type", intent.getQueryType().name().toLowerCase(Locale.ROOT));
        context.put("keywords", intent.getKeywords());
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize query context", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down assistant dispatcher...");
        dispatcher.shutdown();
    }
}
