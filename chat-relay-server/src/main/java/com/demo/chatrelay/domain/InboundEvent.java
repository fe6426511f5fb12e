package com.demo.chatrelay.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A parsed client frame: {@code {"type": ..., "data": ...}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InboundEvent {

    private EventType type;
    private JsonNode data;

    /**
     * Text field of the payload object, or null when absent or not a string.
     */
    public String text(String field) {
        if (data == null || !data.isObject()) {
            return null;
        }
        JsonNode node = data.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    /**
     * Id carried either as the whole payload ({@code "data": "c1"}) or as
     * {@code field} of a payload object.
     */
    public String id(String field) {
        if (data != null && data.isTextual()) {
            return data.asText();
        }
        return text(field);
    }

    /**
     * Boolean field of the payload object, or null when absent or not a boolean.
     */
    public Boolean flag(String field) {
        if (data == null || !data.isObject()) {
            return null;
        }
        JsonNode node = data.get(field);
        return node != null && node.isBoolean() ? node.asBoolean() : null;
    }
}
