package com.example.hubsyncservice.controller;

import com.example.hubsyncservice.dto.WorkspaceSyncResult;
import com.example.hubsyncservice.entity.SyncRun.RunTrigger;
import com.example.hubsyncservice.exception.AuthenticationRequiredException;
import com.example.hubsyncservice.security.AdminAuthGuard;
import com.example.hubsyncservice.service.FullSyncOrchestrator;
import com.example.hubsyncservice.service.IncrementalReconciler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Workspace-wide sync triggers.
 *
 * - GET /api/sync/reconcile: external cron, guarded by {@code Authorization: Bearer <cron-secret>}
 *   (open when no secret is configured)
 * - POST /api/sync/initial: full sync of every active hub, administrators only
 */
@RestController
@RequestMapping("/api/sync")
@Slf4j
public class SyncController {

    private final IncrementalReconciler reconciler;
    private final FullSyncOrchestrator fullSyncOrchestrator;
    private final AdminAuthGuard adminAuthGuard;
    private final String cronSecret;

    public SyncController(IncrementalReconciler reconciler,
                          FullSyncOrchestrator fullSyncOrchestrator,
                          AdminAuthGuard adminAuthGuard,
                          @Value("${hub.sync.cron-secret:}") String cronSecret) {
        this.reconciler = reconciler;
        this.fullSyncOrchestrator = fullSyncOrchestrator;
        this.adminAuthGuard = adminAuthGuard;
        this.cronSecret = cronSecret;
    }

    @GetMapping("/reconcile")
    public ResponseEntity<WorkspaceSyncResult> reconcile(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (cronSecret != null && !cronSecret.isBlank()) {
            if (!constantTimeEquals("Bearer " + cronSecret, authorization)) {
                throw AuthenticationRequiredException.invalidCronSecret();
            }
        } else {
            log.warn("⚠️ hub.sync.cron-secret is not set; reconcile endpoint is open");
        }
        return ResponseEntity.ok(reconciler.reconcileAll(RunTrigger.CRON));
    }

    @PostMapping("/initial")
    public ResponseEntity<WorkspaceSyncResult> initialSync() {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(fullSyncOrchestrator.syncAllHubs(RunTrigger.MANUAL));
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
