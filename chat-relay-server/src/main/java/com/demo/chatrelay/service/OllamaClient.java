package com.demo.chatrelay.service;

import com.demo.chatrelay.domain.BackendStatus;
import com.demo.chatrelay.domain.ChatTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-streaming client for a local Ollama server.
 */
@Slf4j
@Service
public class OllamaClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final double temperature;
    private final int numPredict;

    public OllamaClient(RestTemplate restTemplate,
                        @Value("${ollama.url:http://localhost:11434}") String baseUrl,
                        @Value("${ollama.temperature:0.7}") double temperature,
                        @Value("${ollama.num-predict:500}") int numPredict) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.temperature = temperature;
        this.numPredict = numPredict;
        log.info("OllamaClient initialized: url={}, temperature={}, numPredict={}", this.baseUrl, temperature, numPredict);
    }

    /**
     * Send the conversation and return the assistant's reply text.
     *
     * @throws AssistantBackendException if the server is unreachable, answers
     *                                   with an error status or returns no message
     */
    @SuppressWarnings("unchecked")
    public String chat(String model, List<ChatTurn> messages) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", toWire(messages));
        body.put("stream", false);
        body.put("options", Map.of("temperature", temperature, "num_predict", numPredict));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<Map> response;
        try {
            log.debug("Calling Ollama: model={}, messages={}", model, messages.size());
            response = restTemplate.exchange(baseUrl + "/api/chat", HttpMethod.POST,
                    new HttpEntity<>(body, headers), Map.class);
        } catch (ResourceAccessException e) {
            // A timeout means the server was reached but is slow
            boolean unreachable = !(e.getCause() instanceof SocketTimeoutException);
            throw new AssistantBackendException(e.getMessage(), unreachable, e);
        } catch (RestClientResponseException e) {
            throw new AssistantBackendException(
                    "Ollama returned " + e.getStatusCode().value() + ": " + e.getStatusText(), false, e);
        } catch (RestClientException e) {
            throw new AssistantBackendException(e.getMessage(), false, e);
        }

        Map<String, Object> responseBody = response.getBody();
        Object message = responseBody != null ? responseBody.get("message") : null;
        if (!(message instanceof Map)) {
            throw new AssistantBackendException("Ollama response has no message", false, null);
        }
        Object content = ((Map<String, Object>) message).get("content");
        if (!(content instanceof String)) {
            throw new AssistantBackendException("Ollama response has no message content", false, null);
        }
        return (String) content;
    }

    /**
     * Availability and installed model names. Any failure reports the backend as unavailable.
     */
    @SuppressWarnings("unchecked")
    public BackendStatus status() {
        try {
            ResponseEntity<Map> response = restTemplate.getForEntity(baseUrl + "/api/tags", Map.class);
            List<String> models = new ArrayList<>();
            Map<String, Object> body = response.getBody();
            if (body != null && body.get("models") instanceof List) {
                for (Object entry : (List<Object>) body.get("models")) {
                    if (entry instanceof Map && ((Map<String, Object>) entry).get("name") instanceof String) {
                        models.add((String) ((Map<String, Object>) entry).get("name"));
                    }
                }
            }
            return new BackendStatus(true, models);
        } catch (Exception e) {
            log.debug("Ollama status check failed: {}", e.getMessage());
            return BackendStatus.unavailable();
        }
    }

    private List<Map<String, String>> toWire(List<ChatTurn> messages) {
        List<Map<String, String>> wire = new ArrayList<>(messages.size());
        for (ChatTurn turn : messages) {
            wire.add(Map.of("role", turn.getRole(), "content", turn.getContent()));
        }
        return wire;
    }
}
