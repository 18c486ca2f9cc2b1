package com.example.hubsyncservice.controller;

import com.example.hubsyncservice.entity.WebhookSubscription;
import com.example.hubsyncservice.exception.SignatureInvalidException;
import com.example.hubsyncservice.exception.ValidationException;
import com.example.hubsyncservice.webhook.WebhookEvent;
import com.example.hubsyncservice.webhook.WebhookEventRouter;
import com.example.hubsyncservice.webhook.WebhookOutcome;
import com.example.hubsyncservice.webhook.WebhookSignatureVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

/**
 * Inbound Linear webhook deliveries.
 *
 * Checks run in a fixed order: missing signature (401), unparseable body (400), no matching
 * secret (401). Anything past that is acknowledged with 200, including events that are dropped
 * or fail while being applied; the reconciler repairs those.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String SIGNATURE_HEADER = "linear-signature";

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookEventRouter eventRouter;
    private final ObjectMapper objectMapper;

    @PostMapping("/linear")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature) {

        MDC.put("correlationId", "WEBHOOK-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            if (signature == null || signature.isBlank()) {
                throw SignatureInvalidException.missing();
            }

            byte[] body = rawBody == null ? new byte[0] : rawBody;
            JsonNode payload = parse(body);

            WebhookEvent event = WebhookEvent.from(payload);
            WebhookSubscription subscription = signatureVerifier.verify(body, signature, event.webhookId())
                    .orElseThrow(SignatureInvalidException::mismatch);

            WebhookOutcome outcome = eventRouter.route(event);
            log.debug("Webhook {} {} {} via subscription {} -> {}",
                    event.rawType(), event.action(), event.entityId(), subscription.getId(), outcome);

            return ResponseEntity.ok(Map.of("success", true));
        } finally {
            MDC.remove("correlationId");
        }
    }

    private JsonNode parse(byte[] body) {
        try {
            JsonNode payload = objectMapper.readTree(body);
            if (payload == null || !payload.isObject()) {
                throw ValidationException.invalidJson();
            }
            return payload;
        } catch (IOException e) {
            log.warn("Webhook body is not valid JSON: {}", e.getMessage());
            throw ValidationException.invalidJson();
        }
    }
}
