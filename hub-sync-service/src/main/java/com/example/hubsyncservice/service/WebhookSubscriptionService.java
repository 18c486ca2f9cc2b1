package com.example.hubsyncservice.service;

import com.example.hubsyncservice.client.external.LinearClient;
import com.example.hubsyncservice.dto.response.WebhookSubscriptionResponse;
import com.example.hubsyncservice.dto.response.WorkspaceStatusResponse;
import com.example.hubsyncservice.entity.WebhookSubscription;
import com.example.hubsyncservice.exception.ConflictException;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.exception.ValidationException;
import com.example.hubsyncservice.repository.WebhookSubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of the workspace webhook: register it upstream with a fresh signing secret, rotate
 * that secret, or remove it.
 *
 * Upstream mutations run outside any transaction; the local row is written only after the
 * upstream call succeeded.
 */
@Service
@Slf4j
public class WebhookSubscriptionService {

    static final List<String> RESOURCE_TYPES = List.of("Issue", "Comment", "Project", "Initiative");

    private final WebhookSubscriptionRepository subscriptionRepository;
    private final WorkspaceTokenService tokenService;
    private final SecretEncryptionService encryptionService;
    private final LinearClient linearClient;
    private final String publicUrl;
    private final String workspaceId;

    public WebhookSubscriptionService(WebhookSubscriptionRepository subscriptionRepository,
                                      WorkspaceTokenService tokenService,
                                      SecretEncryptionService encryptionService,
                                      LinearClient linearClient,
                                      @Value("${hub.webhook.public-url:}") String publicUrl,
                                      @Value("${hub.workspace-id:workspace}") String workspaceId) {
        this.subscriptionRepository = subscriptionRepository;
        this.tokenService = tokenService;
        this.encryptionService = encryptionService;
        this.linearClient = linearClient;
        this.publicUrl = publicUrl;
        this.workspaceId = workspaceId;
    }

    public WorkspaceStatusResponse status() {
        Optional<WebhookSubscription> active = current();
        return new WorkspaceStatusResponse(
                workspaceId,
                tokenService.isConnected(),
                active.isPresent(),
                active.map(WebhookSubscription::getWebhookId).orElse(null),
                active.map(WebhookSubscription::getUrl).orElse(null));
    }

    public WebhookSubscriptionResponse connect() {
        current().ifPresent(existing -> {
            throw ConflictException.webhookExists(existing.getWebhookId());
        });
        if (publicUrl == null || publicUrl.isBlank()) {
            throw new ValidationException("WEBHOOK_URL_MISSING", "hub.webhook.public-url is not configured");
        }

        String secret = encryptionService.generateWebhookSecret();
        String webhookId = linearClient.createWebhook(tokenService.getToken(), publicUrl, secret, RESOURCE_TYPES);

        WebhookSubscription saved = subscriptionRepository.save(WebhookSubscription.builder()
                .webhookId(webhookId)
                .encryptedSecret(encryptionService.encrypt(secret))
                .url(publicUrl)
                .build());
        log.info("✅ Webhook {} registered for {}", webhookId, publicUrl);
        return WebhookSubscriptionResponse.from(saved);
    }

    public WebhookSubscriptionResponse rotateSecret() {
        WebhookSubscription subscription = current()
                .orElseThrow(() -> ResourceNotFoundException.webhook("active"));

        String secret = encryptionService.generateWebhookSecret();
        linearClient.updateWebhookSecret(tokenService.getToken(), subscription.getWebhookId(), secret);

        subscription.setEncryptedSecret(encryptionService.encrypt(secret));
        WebhookSubscription saved = subscriptionRepository.save(subscription);
        log.info("✅ Signing secret of webhook {} rotated", subscription.getWebhookId());
        return WebhookSubscriptionResponse.from(saved);
    }

    public void disconnect() {
        WebhookSubscription subscription = current()
                .orElseThrow(() -> ResourceNotFoundException.webhook("active"));

        linearClient.deleteWebhook(tokenService.getToken(), subscription.getWebhookId());

        subscription.setActive(false);
        subscriptionRepository.save(subscription);
        log.warn("Webhook {} disconnected", subscription.getWebhookId());
    }

    private Optional<WebhookSubscription> current() {
        return subscriptionRepository.findByActiveTrueOrderByIdAsc().stream().findFirst();
    }
}
