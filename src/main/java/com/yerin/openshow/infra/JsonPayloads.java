package com.yerin.openshow.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts job payloads and results between {@link JsonNode} and the text columns they are stored in.
 */
@Component
@RequiredArgsConstructor
public class JsonPayloads {

    private final ObjectMapper objectMapper;

    public String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node == null ? emptyObject() : node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("payload serialize error", e);
        }
    }

    public JsonNode read(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("payload parse error", e);
        }
    }

    public ObjectNode emptyObject() {
        return objectMapper.createObjectNode();
    }
}
