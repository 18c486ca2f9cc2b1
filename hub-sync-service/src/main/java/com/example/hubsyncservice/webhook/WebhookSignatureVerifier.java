package com.example.hubsyncservice.webhook;

import com.example.hubsyncservice.entity.WebhookSubscription;
import com.example.hubsyncservice.exception.EncryptionException;
import com.example.hubsyncservice.repository.WebhookSubscriptionRepository;
import com.example.hubsyncservice.service.SecretEncryptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Authenticates webhook deliveries: HMAC-SHA256 over the raw body, hex encoded, compared in
 * constant time.
 *
 * When the payload names a known active subscription only that secret is tried. Otherwise every
 * active subscription is tried in order. No subscriptions means nothing verifies.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private final WebhookSubscriptionRepository subscriptionRepository;
    private final SecretEncryptionService encryptionService;

    /**
     * @return the subscription whose secret produced the signature
     */
    public Optional<WebhookSubscription> verify(byte[] rawBody, String signature, String webhookId) {
        if (signature == null || signature.isBlank()) {
            return Optional.empty();
        }

        List<WebhookSubscription> candidates = candidates(webhookId);
        for (WebhookSubscription subscription : candidates) {
            String secret;
            try {
                secret = encryptionService.decrypt(subscription.getEncryptedSecret());
            } catch (EncryptionException e) {
                log.error("❌ Cannot decrypt secret of webhook subscription {}, skipping it", subscription.getWebhookId());
                continue;
            }
            if (matches(rawBody, signature, secret)) {
                return Optional.of(subscription);
            }
        }

        log.warn("⚠️ Webhook signature did not match any of {} candidate subscription(s)", candidates.size());
        return Optional.empty();
    }

    private List<WebhookSubscription> candidates(String webhookId) {
        if (webhookId != null) {
            Optional<WebhookSubscription> named = subscriptionRepository.findByWebhookIdAndActiveTrue(webhookId);
            if (named.isPresent()) {
                return List.of(named.get());
            }
        }
        return subscriptionRepository.findByActiveTrueOrderByIdAsc();
    }

    static boolean matches(byte[] rawBody, String signature, String secret) {
        String expected = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret.getBytes(StandardCharsets.UTF_8))
                .hmacHex(rawBody);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }
}
