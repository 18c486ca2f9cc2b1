package com.example.hubsyncservice.webhook;

public enum WebhookAction {
    CREATE,
    UPDATE,
    REMOVE,
    UNKNOWN;

    public static WebhookAction fromWire(String action) {
        if (action == null) {
            return UNKNOWN;
        }
        return switch (action) {
            case "create" -> CREATE;
            case "update" -> UPDATE;
            case "remove" -> REMOVE;
            default -> UNKNOWN;
        };
    }
}
