package com.example.hubsyncservice.webhook;

/**
 * What happened to a verified webhook delivery. Every outcome is acknowledged with 200.
 */
public enum WebhookOutcome {
    /** Mirror row upserted or deleted. */
    PROCESSED,
    /** Entity belongs to a team no active hub maps; mirror untouched. */
    DROPPED_UNTRACKED,
    /** Unknown entity type or action, or a payload without an id. */
    IGNORED,
    /** Handler error, logged; the next reconciliation repairs the mirror. */
    FAILED
}
