package com.example.hubsyncservice.controller;

import com.example.hubsyncservice.dto.request.StoreTokenRequest;
import com.example.hubsyncservice.dto.response.WebhookSubscriptionResponse;
import com.example.hubsyncservice.dto.response.WorkspaceStatusResponse;
import com.example.hubsyncservice.security.AdminAuthGuard;
import com.example.hubsyncservice.security.AuthenticatedIdentity;
import com.example.hubsyncservice.service.WebhookSubscriptionService;
import com.example.hubsyncservice.service.WorkspaceTokenService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Workspace connection: API token and webhook registration.
 */
@RestController
@RequestMapping("/api/admin/workspace")
@RequiredArgsConstructor
@Slf4j
public class AdminWorkspaceController {

    private final AdminAuthGuard adminAuthGuard;
    private final WorkspaceTokenService tokenService;
    private final WebhookSubscriptionService webhookService;

    @GetMapping("/status")
    public ResponseEntity<WorkspaceStatusResponse> status() {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(webhookService.status());
    }

    @PutMapping("/token")
    public ResponseEntity<WorkspaceStatusResponse> storeToken(@Valid @RequestBody StoreTokenRequest request) {
        AuthenticatedIdentity admin = adminAuthGuard.requireAdmin();
        log.info("Storing workspace API token by {}", admin.getId());
        tokenService.storeToken(request.token());
        return ResponseEntity.ok(webhookService.status());
    }

    @PostMapping("/webhook")
    public ResponseEntity<WebhookSubscriptionResponse> connectWebhook() {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.status(HttpStatus.CREATED).body(webhookService.connect());
    }

    @PostMapping("/webhook/rotate")
    public ResponseEntity<WebhookSubscriptionResponse> rotateWebhookSecret() {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(webhookService.rotateSecret());
    }

    @DeleteMapping("/webhook")
    public ResponseEntity<Void> disconnectWebhook() {
        adminAuthGuard.requireAdmin();
        webhookService.disconnect();
        return ResponseEntity.noContent().build();
    }
}
