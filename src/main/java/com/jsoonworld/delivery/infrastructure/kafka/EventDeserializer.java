package com.jsoonworld.delivery.infrastructure.kafka;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class EventDeserializer {

    private static final Logger log = LoggerFactory.getLogger(EventDeserializer.class);

    private final ObjectMapper objectMapper;

    public EventDeserializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode deserialize(String json) {
        if (json == null || json.isBlank()) {
            throw new DeserializationException("Empty event payload");
        }
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            log.error("Failed to deserialize task event JSON: {}", e.getMessage());
            throw new DeserializationException("Failed to deserialize event: " + e.getMessage(), e);
        }
    }

    public String extractEventId(JsonNode node) {
        return requiredText(node, "eventId");
    }

    public String extractEventType(JsonNode node) {
        return requiredText(node, "eventType");
    }

    public JsonNode extractPayload(JsonNode node) {
        JsonNode payloadNode = node.get("payload");
        if (payloadNode == null || payloadNode.isNull()) {
            throw new DeserializationException("Missing payload in task event");
        }
        return payloadNode;
    }

    public String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public Map<String, String> extractVariables(JsonNode payload) {
        Map<String, String> variables = new LinkedHashMap<>();
        JsonNode variablesNode = payload.get("variables");
        if (variablesNode == null || !variablesNode.isObject()) {
            return variables;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = variablesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            variables.put(field.getKey(), field.getValue().asText());
        }
        return variables;
    }

    private String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new DeserializationException("Missing " + field + " in task event");
        }
        return value.asText();
    }

    public static class DeserializationException extends RuntimeException {
        public DeserializationException(String message) {
            super(message);
        }

        public DeserializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
