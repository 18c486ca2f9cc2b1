package com.example.hubsyncservice.service;

import com.example.hubsyncservice.dto.HubSyncResult;
import com.example.hubsyncservice.dto.SyncCounts;
import com.example.hubsyncservice.dto.TeamSyncResult;
import com.example.hubsyncservice.dto.WorkspaceSyncResult;
import com.example.hubsyncservice.entity.SyncRun;
import com.example.hubsyncservice.entity.SyncRun.RunTrigger;
import com.example.hubsyncservice.repository.SyncRunRepository;
import com.example.hubsyncservice.service.SyncTargetResolver.TeamTarget;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * "Changed since" sync, the compensating control for webhook events that were dropped or
 * failed.
 *
 * Watermark per hub: start of the last COMPLETED run covering the hub minus the overlap
 * window (60s), or now minus the default lookback (10 min) when there is none. Runs with
 * errors end as PARTIAL_FAILURE and do not move the watermark, so the next run repeats the
 * window. Overlapping windows are harmless because every write is an upsert.
 */
@Service
@Slf4j
public class IncrementalReconciler {

    private final SyncTargetResolver targetResolver;
    private final WorkspaceTokenService tokenService;
    private final MirrorSyncService mirrorSyncService;
    private final SyncRunService syncRunService;
    private final SyncRunRepository syncRunRepository;
    private final Clock clock;
    private final Duration overlap;
    private final Duration defaultLookback;

    public IncrementalReconciler(SyncTargetResolver targetResolver,
                                 WorkspaceTokenService tokenService,
                                 MirrorSyncService mirrorSyncService,
                                 SyncRunService syncRunService,
                                 SyncRunRepository syncRunRepository,
                                 Clock clock,
                                 @Value("${hub.sync.reconcile.overlap-seconds:60}") long overlapSeconds,
                                 @Value("${hub.sync.reconcile.default-lookback-minutes:10}") long lookbackMinutes) {
        this.targetResolver = targetResolver;
        this.tokenService = tokenService;
        this.mirrorSyncService = mirrorSyncService;
        this.syncRunService = syncRunService;
        this.syncRunRepository = syncRunRepository;
        this.clock = clock;
        this.overlap = Duration.ofSeconds(overlapSeconds);
        this.defaultLookback = Duration.ofMinutes(lookbackMinutes);
    }

    public Instant watermarkFor(UUID hubId) {
        return syncRunRepository.findLastCompletedCoveringHub(hubId)
                .map(run -> run.getStartedAt().minus(overlap))
                .orElseGet(() -> clock.instant().minus(defaultLookback));
    }

    /**
     * Manual reconcile of one hub: org level and the hub's teams since its watermark.
     */
    public HubSyncResult reconcileHub(UUID hubId, RunTrigger trigger) {
        String correlationId = "RECONCILE-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);
        long startTime = clock.millis();

        try {
            List<TeamTarget> teams = targetResolver.teamsOfHub(hubId);
            Instant watermark = watermarkFor(hubId);
            log.info("Starting reconcile of hub {}: {} team(s) since {}", hubId, teams.size(), watermark);

            SyncRun run = syncRunService.startRun(hubId, SyncRun.RunType.RECONCILE, trigger, correlationId);
            HubSyncResult.HubSyncResultBuilder result = HubSyncResult.builder()
                    .hubId(hubId)
                    .runType(SyncRun.RunType.RECONCILE.name())
                    .syncRunId(run.getId())
                    .correlationId(correlationId)
                    .watermark(watermark);

            String token;
            try {
                token = tokenService.getToken();
            } catch (RuntimeException e) {
                syncRunService.failRun(run.getId(), e.getMessage());
                return result.success(false)
                        .counts(SyncCounts.builder().errors(1).build())
                        .teams(List.of())
                        .errorMessage(e.getMessage())
                        .durationMs(clock.millis() - startTime)
                        .build();
            }

            SyncCounts counts = new SyncCounts();
            mirrorSyncService.syncOrgLevel(token, watermark, counts);
            List<TeamSyncResult> teamResults = new ArrayList<>();
            for (TeamTarget team : FullSyncOrchestrator.distinctTeams(teams)) {
                TeamSyncResult teamResult = mirrorSyncService.reconcileTeam(token, team.teamId(), team.teamName(), watermark);
                MirrorSyncService.accumulate(counts, teamResult);
                teamResults.add(teamResult);
            }

            syncRunService.finishRun(run.getId(), counts);
            long duration = clock.millis() - startTime;
            log.info("✅ Reconcile of hub {} done: issues={}, comments={}, errors={}, duration={}ms",
                    hubId, counts.getIssues(), counts.getComments(), counts.getErrors(), duration);

            return result.success(true).counts(counts).teams(teamResults).durationMs(duration).build();
        } finally {
            MDC.remove("correlationId");
        }
    }

    /**
     * Reconcile every active hub. Org-level entities are fetched once from the oldest hub
     * watermark; each team is fetched once, from its hub's watermark. One RECONCILE run is
     * recorded per hub.
     */
    public WorkspaceSyncResult reconcileAll(RunTrigger trigger) {
        String correlationId = MDC.get("correlationId");
        boolean ownsCorrelationId = correlationId == null;
        if (ownsCorrelationId) {
            correlationId = "RECONCILE-" + UUID.randomUUID().toString().substring(0, 8);
            MDC.put("correlationId", correlationId);
        }
        long startTime = clock.millis();

        try {
            Map<UUID, List<TeamTarget>> byHub = targetResolver.teamsByActiveHub();
            WorkspaceSyncResult.WorkspaceSyncResultBuilder result = WorkspaceSyncResult.builder()
                    .runType(SyncRun.RunType.RECONCILE.name())
                    .correlationId(correlationId)
                    .hubs(byHub.size());

            if (byHub.isEmpty()) {
                log.info("No active hubs with team mappings, nothing to reconcile");
                return result.counts(new SyncCounts()).hubResults(List.of()).build();
            }

            Map<UUID, Instant> watermarks = new LinkedHashMap<>();
            byHub.keySet().forEach(hubId -> watermarks.put(hubId, watermarkFor(hubId)));
            Instant orgWatermark = watermarks.values().stream().min(Instant::compareTo).orElseThrow();

            String token;
            try {
                token = tokenService.getToken();
            } catch (RuntimeException e) {
                SyncRun failed = syncRunService.startRun(null, SyncRun.RunType.RECONCILE, trigger, correlationId);
                syncRunService.failRun(failed.getId(), e.getMessage());
                return result.counts(SyncCounts.builder().errors(1).build())
                        .errorMessage(e.getMessage())
                        .durationMs(clock.millis() - startTime)
                        .build();
            }

            SyncCounts total = new SyncCounts();
            mirrorSyncService.syncOrgLevel(token, orgWatermark, total);
            int orgErrors = total.getErrors();

            Set<String> seenTeams = new HashSet<>();
            List<HubSyncResult> hubResults = new ArrayList<>();
            int teamCount = 0;
            for (Map.Entry<UUID, List<TeamTarget>> entry : byHub.entrySet()) {
                UUID hubId = entry.getKey();
                Instant watermark = watermarks.get(hubId);
                SyncRun run = syncRunService.startRun(hubId, SyncRun.RunType.RECONCILE, trigger, correlationId);

                SyncCounts hubCounts = new SyncCounts();
                List<TeamSyncResult> teamResults = new ArrayList<>();
                for (TeamTarget team : entry.getValue()) {
                    if (!seenTeams.add(team.teamId())) {
                        continue;
                    }
                    TeamSyncResult teamResult = mirrorSyncService.reconcileTeam(token, team.teamId(), team.teamName(), watermark);
                    MirrorSyncService.accumulate(hubCounts, teamResult);
                    teamResults.add(teamResult);
                }
                teamCount += teamResults.size();
                total.merge(hubCounts);

                // A failed org-level step keeps this hub's watermark where it was.
                SyncCounts runCounts = SyncCounts.builder().build();
                runCounts.merge(hubCounts);
                runCounts.setErrors(hubCounts.getErrors() + orgErrors);
                syncRunService.finishRun(run.getId(), runCounts);

                hubResults.add(HubSyncResult.builder()
                        .hubId(hubId)
                        .runType(SyncRun.RunType.RECONCILE.name())
                        .syncRunId(run.getId())
                        .correlationId(correlationId)
                        .success(true)
                        .watermark(watermark)
                        .counts(hubCounts)
                        .teams(teamResults)
                        .build());
            }

            long duration = clock.millis() - startTime;
            log.info("✅ Reconcile complete: {} hubs, {} teams, {} issues, {} comments, {} projects, {} initiatives, {} errors, duration={}ms",
                    byHub.size(), teamCount, total.getIssues(), total.getComments(), total.getProjects(),
                    total.getInitiatives(), total.getErrors(), duration);

            return result.teams(teamCount)
                    .counts(total)
                    .hubResults(hubResults)
                    .durationMs(duration)
                    .build();
        } finally {
            if (ownsCorrelationId) {
                MDC.remove("correlationId");
            }
        }
    }
}
