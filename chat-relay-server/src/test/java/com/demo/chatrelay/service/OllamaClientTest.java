package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.BackendStatus;
import com.demo.chatrelay.domain.ChatTurn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaClientTest {

    private MockRestServiceServer server;
    private OllamaClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new OllamaClient(restTemplate, "http://ollama:11434/", 0.7, 500);
    }

    @Test
    void shouldPostNonStreamingChatAndReturnReply() {
        // Given: Ollama answers with a message
        server.expect(requestTo("http://ollama:11434/api/chat"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.model").value("gemma3:1b"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.options.temperature").value(0.7))
                .andExpect(jsonPath("$.options.num_predict").value(500))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("hi"))
                .andRespond(withSuccess(
                        "{\"model\":\"gemma3:1b\",\"message\":{\"role\":\"assistant\",\"content\":\"Hello!\"},\"done\":true}",
                        MediaType.APPLICATION_JSON));

        // When: Sending a conversation
        String reply = client.chat("gemma3:1b", List.of(
                ChatTurn.of(ChatTurn.SYSTEM, "be nice"),
                ChatTurn.of(ChatTurn.USER, "hi")));

        // Then: The assistant content is returned
        assertEquals("Hello!", reply);
        server.verify();
    }

    @Test
    void shouldReportErrorStatusAsBackendFailure() {
        server.expect(requestTo("http://ollama:11434/api/chat"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        AssistantBackendException error = assertThrows(AssistantBackendException.class,
                () -> client.chat("missing-model", List.of(ChatTurn.of(ChatTurn.USER, "hi"))));

        assertFalse(error.isUnreachable());
        assertEquals("Ollama returned 404: Not Found", error.getMessage());
    }

    @Test
    void shouldReportConnectionFailureAsUnreachable() {
        server.expect(requestTo("http://ollama:11434/api/chat"))
                .andRespond(withException(new ConnectException("Connection refused")));

        AssistantBackendException error = assertThrows(AssistantBackendException.class,
                () -> client.chat("gemma3:1b", List.of(ChatTurn.of(ChatTurn.USER, "hi"))));

        assertTrue(error.isUnreachable());
    }

    @Test
    void shouldNotReportReadTimeoutAsUnreachable() {
        // Given: Ollama accepts the request but never answers in time
        server.expect(requestTo("http://ollama:11434/api/chat"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        // When: Sending a conversation
        AssistantBackendException error = assertThrows(AssistantBackendException.class,
                () -> client.chat("gemma3:1b", List.of(ChatTurn.of(ChatTurn.USER, "hi"))));

        // Then: It is an ordinary backend error carrying the timeout
        assertFalse(error.isUnreachable());
        assertTrue(error.getMessage().contains("Read timed out"));
    }

    @Test
    void shouldListInstalledModels() {
        server.expect(requestTo("http://ollama:11434/api/tags"))
                .andRespond(withSuccess(
                        "{\"models\":[{\"name\":\"gemma3:1b\"},{\"name\":\"llama3:8b\"}]}",
                        MediaType.APPLICATION_JSON));

        BackendStatus status = client.status();

        assertTrue(status.isAvailable());
        assertEquals(List.of("gemma3:1b", "llama3:8b"), status.getModels());
    }

    @Test
    void shouldReportUnavailableWhenStatusCheckFails() {
        server.expect(requestTo("http://ollama:11434/api/tags"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        BackendStatus status = client.status();

        assertFalse(status.isAvailable());
        assertTrue(status.getModels().isEmpty());
    }
}
