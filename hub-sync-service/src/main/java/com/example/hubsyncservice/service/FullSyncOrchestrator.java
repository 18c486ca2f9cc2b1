package com.example.hubsyncservice.service;

import com.example.hubsyncservice.dto.HubSyncResult;
import com.example.hubsyncservice.dto.SyncCounts;
import com.example.hubsyncservice.dto.TeamSyncResult;
import com.example.hubsyncservice.dto.WorkspaceSyncResult;
import com.example.hubsyncservice.entity.SyncRun;
import com.example.hubsyncservice.entity.SyncRun.RunTrigger;
import com.example.hubsyncservice.service.SyncTargetResolver.TeamTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Full (unfiltered) sync of the mirror.
 *
 * FLOW:
 * 1. Resolve the teams to cover (validation errors abort before anything is recorded)
 * 2. Record a RUNNING sync run
 * 3. Obtain the workspace token; failing here is the only overall failure
 * 4. Org level once: teams, then initiatives (non-fatal)
 * 5. Each distinct team, sequentially: projects, issues, per-issue comments; a team failure
 *    is counted and the loop continues
 * 6. Close the run: COMPLETED, or PARTIAL_FAILURE when any error was counted
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FullSyncOrchestrator {

    private final SyncTargetResolver targetResolver;
    private final WorkspaceTokenService tokenService;
    private final MirrorSyncService mirrorSyncService;
    private final SyncRunService syncRunService;
    private final Clock clock;

    /**
     * Manual sync of one hub's mapped teams.
     */
    public HubSyncResult syncHub(UUID hubId, RunTrigger trigger) {
        String correlationId = "SYNC-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);
        long startTime = clock.millis();

        try {
            List<TeamTarget> teams = targetResolver.teamsOfHub(hubId);
            log.info("Starting full sync of hub {}: {} team(s), trigger={}", hubId, teams.size(), trigger);

            SyncRun run = syncRunService.startRun(hubId, SyncRun.RunType.FULL_SYNC, trigger, correlationId);
            HubSyncResult.HubSyncResultBuilder result = HubSyncResult.builder()
                    .hubId(hubId)
                    .runType(SyncRun.RunType.FULL_SYNC.name())
                    .syncRunId(run.getId())
                    .correlationId(correlationId);

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
            mirrorSyncService.syncOrgLevel(token, null, counts);
            List<TeamSyncResult> teamResults = syncTeams(token, distinctTeams(teams), counts);

            syncRunService.finishRun(run.getId(), counts);
            long duration = clock.millis() - startTime;
            log.info("✅ Full sync of hub {} done: teams={}, projects={}, issues={}, comments={}, errors={}, duration={}ms",
                    hubId, teamResults.size(), counts.getProjects(), counts.getIssues(), counts.getComments(),
                    counts.getErrors(), duration);

            return result.success(true)
                    .counts(counts)
                    .teams(teamResults)
                    .durationMs(duration)
                    .build();
        } finally {
            MDC.remove("correlationId");
        }
    }

    /**
     * Initial workspace sync over every active hub. Each team is fetched once even if it shows
     * up under several hubs while a remap is in flight.
     */
    public WorkspaceSyncResult syncAllHubs(RunTrigger trigger) {
        String correlationId = "SYNC-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);
        long startTime = clock.millis();

        try {
            Map<UUID, List<TeamTarget>> byHub = targetResolver.teamsByActiveHub();
            List<TeamTarget> teams = distinctTeams(byHub.values().stream().flatMap(Collection::stream).toList());
            log.info("Starting workspace sync: {} hub(s), {} team(s), trigger={}", byHub.size(), teams.size(), trigger);

            SyncRun run = syncRunService.startRun(null, SyncRun.RunType.FULL_SYNC, trigger, correlationId);
            WorkspaceSyncResult.WorkspaceSyncResultBuilder result = WorkspaceSyncResult.builder()
                    .runType(SyncRun.RunType.FULL_SYNC.name())
                    .correlationId(correlationId)
                    .hubs(byHub.size())
                    .teams(teams.size());

            String token;
            try {
                token = tokenService.getToken();
            } catch (RuntimeException e) {
                syncRunService.failRun(run.getId(), e.getMessage());
                return result.counts(SyncCounts.builder().errors(1).build())
                        .errorMessage(e.getMessage())
                        .durationMs(clock.millis() - startTime)
                        .build();
            }

            SyncCounts counts = new SyncCounts();
            mirrorSyncService.syncOrgLevel(token, null, counts);
            syncTeams(token, teams, counts);

            syncRunService.finishRun(run.getId(), counts);
            long duration = clock.millis() - startTime;
            log.info("✅ Workspace sync done: teams={}, issues={}, comments={}, errors={}, duration={}ms",
                    teams.size(), counts.getIssues(), counts.getComments(), counts.getErrors(), duration);

            return result.counts(counts).durationMs(duration).build();
        } finally {
            MDC.remove("correlationId");
        }
    }

    private List<TeamSyncResult> syncTeams(String token, List<TeamTarget> teams, SyncCounts counts) {
        List<TeamSyncResult> results = new ArrayList<>();
        for (TeamTarget team : teams) {
            TeamSyncResult teamResult = mirrorSyncService.syncTeam(token, team.teamId(), team.teamName());
            MirrorSyncService.accumulate(counts, teamResult);
            results.add(teamResult);
        }
        return results;
    }

    static List<TeamTarget> distinctTeams(List<TeamTarget> teams) {
        Map<String, TeamTarget> byTeamId = new LinkedHashMap<>();
        for (TeamTarget team : teams) {
            byTeamId.putIfAbsent(team.teamId(), team);
        }
        return new ArrayList<>(byTeamId.values());
    }
}
