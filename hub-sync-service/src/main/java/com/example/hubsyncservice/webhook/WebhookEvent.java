package com.example.hubsyncservice.webhook;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parsed webhook envelope: {@code {action, type, data, createdAt, webhookId?}}.
 */
public record WebhookEvent(WebhookAction action,
                           WebhookEntityType entityType,
                           String rawType,
                           JsonNode data,
                           String webhookId,
                           String createdAt) {

    public static WebhookEvent from(JsonNode payload) {
        String rawType = textOrNull(payload.path("type"));
        return new WebhookEvent(
                WebhookAction.fromWire(textOrNull(payload.path("action"))),
                WebhookEntityType.fromWire(rawType),
                rawType,
                payload.path("data"),
                textOrNull(payload.path("webhookId")),
                textOrNull(payload.path("createdAt")));
    }

    public String entityId() {
        return textOrNull(data.path("id"));
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
