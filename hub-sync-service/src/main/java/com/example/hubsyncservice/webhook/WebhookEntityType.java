package com.example.hubsyncservice.webhook;

/**
 * Upstream event kinds the router understands. Anything else is {@link #UNHANDLED} and only
 * logged, so new upstream kinds never break ingestion.
 */
public enum WebhookEntityType {
    ISSUE("Issue"),
    COMMENT("Comment"),
    PROJECT("Project"),
    INITIATIVE("Initiative"),
    UNHANDLED(null);

    private final String wireName;

    WebhookEntityType(String wireName) {
        this.wireName = wireName;
    }

    public static WebhookEntityType fromWire(String type) {
        for (WebhookEntityType value : values()) {
            if (value.wireName != null && value.wireName.equals(type)) {
                return value;
            }
        }
        return UNHANDLED;
    }
}
