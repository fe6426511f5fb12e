package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.ChatTurn;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(BotChatService.class)
class BotChatServiceTest {

    @Autowired
    private BotChatService botChatService;

    private void save(String userId, String role, String content) throws InterruptedException {
        botChatService.saveBotMessage(userId, role, content, "gemma3:1b", null);
        Thread.sleep(2);
    }

    @Test
    void shouldReturnMostRecentTurnsOldestFirst() throws Exception {
        // Given: Four turns for one user and one for another
        save("u1", ChatTurn.USER, "q1");
        save("u1", ChatTurn.ASSISTANT, "a1");
        save("u2", ChatTurn.USER, "other");
        save("u1", ChatTurn.USER, "q2");
        save("u1", ChatTurn.ASSISTANT, "a2");

        // When: Asking for the last three
        List<ChatTurn> history = botChatService.getBotHistory("u1", 3);

        // Then: The newest three of that user, in conversation order
        assertEquals(List.of(
                ChatTurn.of(ChatTurn.ASSISTANT, "a1"),
                ChatTurn.of(ChatTurn.USER, "q2"),
                ChatTurn.of(ChatTurn.ASSISTANT, "a2")), history);
    }

    @Test
    void shouldClearOnlyThatUsersHistory() throws Exception {
        save("u1", ChatTurn.USER, "q1");
        save("u1", ChatTurn.ASSISTANT, "a1");
        save("u2", ChatTurn.USER, "keep me");

        long deleted = botChatService.clearBotHistory("u1");

        assertEquals(2, deleted);
        assertTrue(botChatService.getBotHistory("u1", 50).isEmpty());
        assertEquals(1, botChatService.getBotHistory("u2", 50).size());
    }
}
