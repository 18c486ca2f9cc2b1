package com.example.hubsyncservice.scheduler;

import com.example.hubsyncservice.dto.WorkspaceSyncResult;
import com.example.hubsyncservice.entity.SyncRun.RunTrigger;
import com.example.hubsyncservice.service.IncrementalReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * In-process trigger for the periodic reconciliation of every active hub.
 *
 * - @SchedulerLock: only one replica runs a tick; HTTP-triggered runs are not locked
 * - No business logic here, the reconciler owns it
 * - Disabled with {@code hub.sync.scheduler.enabled=false} when an external cron calls
 *   {@code GET /api/sync/reconcile} instead
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "hub.sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class ReconcileScheduler {

    private final IncrementalReconciler reconciler;

    /**
     * Default: every 5 minutes. Lock: max 4 minutes.
     */
    @Scheduled(cron = "${hub.sync.scheduler.reconcile-cron:0 */5 * * * *}")
    @SchedulerLock(
            name = "reconcileAllHubs",
            lockAtMostFor = "4m",
            lockAtLeastFor = "30s"
    )
    public void reconcileAllHubs() {
        String correlationId = "SCHEDULER-RECONCILE-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            log.info("=== Starting scheduled reconcile: correlationId={} ===", correlationId);
            WorkspaceSyncResult result = reconciler.reconcileAll(RunTrigger.SCHEDULER);
            log.info("=== Completed scheduled reconcile: hubs={}, teams={}, errors={} ===",
                    result.getHubs(), result.getTeams(), result.getCounts().getErrors());
        } catch (Exception e) {
            log.error("Error in scheduled reconcile: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
