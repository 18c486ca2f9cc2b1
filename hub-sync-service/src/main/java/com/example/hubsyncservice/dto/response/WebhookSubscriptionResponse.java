package com.example.hubsyncservice.dto.response;

import com.example.hubsyncservice.entity.WebhookSubscription;

import java.time.Instant;

/**
 * Never carries the signing secret.
 */
public record WebhookSubscriptionResponse(Long id, String webhookId, String url, boolean active, Instant createdAt) {

    public static WebhookSubscriptionResponse from(WebhookSubscription subscription) {
        return new WebhookSubscriptionResponse(subscription.getId(), subscription.getWebhookId(),
                subscription.getUrl(), subscription.isActive(), subscription.getCreatedAt());
    }
}
