package com.example.hubsyncservice.controller;

import com.example.hubsyncservice.dto.HubSyncResult;
import com.example.hubsyncservice.dto.response.SyncRunResponse;
import com.example.hubsyncservice.entity.SyncRun.RunTrigger;
import com.example.hubsyncservice.security.AdminAuthGuard;
import com.example.hubsyncservice.security.AuthenticatedIdentity;
import com.example.hubsyncservice.service.FullSyncOrchestrator;
import com.example.hubsyncservice.service.IncrementalReconciler;
import com.example.hubsyncservice.service.SyncRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Manual per-hub runs and run history.
 *
 * Hub runs answer 404 for an unknown hub, 400 for an inactive hub or one without teams. A run
 * that starts always answers 200; per-team failures are reported in the body.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminSyncController {

    private final AdminAuthGuard adminAuthGuard;
    private final FullSyncOrchestrator fullSyncOrchestrator;
    private final IncrementalReconciler reconciler;
    private final SyncRunService syncRunService;

    @PostMapping("/hubs/{hubId}/sync")
    public ResponseEntity<HubSyncResult> syncHub(@PathVariable UUID hubId) {
        AuthenticatedIdentity admin = adminAuthGuard.requireAdmin();
        log.info("Manual full sync of hub {} requested by {}", hubId, admin.getId());
        return ResponseEntity.ok(fullSyncOrchestrator.syncHub(hubId, RunTrigger.MANUAL));
    }

    @PostMapping("/hubs/{hubId}/reconcile")
    public ResponseEntity<HubSyncResult> reconcileHub(@PathVariable UUID hubId) {
        AuthenticatedIdentity admin = adminAuthGuard.requireAdmin();
        log.info("Manual reconcile of hub {} requested by {}", hubId, admin.getId());
        return ResponseEntity.ok(reconciler.reconcileHub(hubId, RunTrigger.MANUAL));
    }

    @GetMapping("/sync-runs")
    public ResponseEntity<List<SyncRunResponse>> recentRuns(
            @RequestParam(required = false) UUID hubId,
            @RequestParam(defaultValue = "20") int limit) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(syncRunService.recentRuns(hubId, limit).stream()
                .map(SyncRunResponse::from)
                .toList());
    }
}
