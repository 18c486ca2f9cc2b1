package com.example.hubsyncservice.service;

import com.example.hubsyncservice.dto.HubSyncResult;
import com.example.hubsyncservice.dto.SyncCounts;
import com.example.hubsyncservice.dto.TeamSyncResult;
import com.example.hubsyncservice.dto.WorkspaceSyncResult;
import com.example.hubsyncservice.entity.SyncRun;
import com.example.hubsyncservice.entity.SyncRun.RunTrigger;
import com.example.hubsyncservice.exception.ValidationException;
import com.example.hubsyncservice.exception.WorkspaceNotConnectedException;
import com.example.hubsyncservice.service.SyncTargetResolver.TeamTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FullSyncOrchestratorTest {

    private static final UUID HUB_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID OTHER_HUB_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");

    @Mock
    private SyncTargetResolver targetResolver;

    @Mock
    private WorkspaceTokenService tokenService;

    @Mock
    private MirrorSyncService mirrorSyncService;

    @Mock
    private SyncRunService syncRunService;

    private FullSyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        orchestrator = new FullSyncOrchestrator(targetResolver, tokenService, mirrorSyncService, syncRunService, clock);
    }

    @Test
    void testSyncHub_TeamFailure_CountedAndLoopContinues() {
        // GIVEN: two mapped teams, the first one fails upstream
        when(targetResolver.teamsOfHub(HUB_ID)).thenReturn(List.of(
                new TeamTarget(HUB_ID, "team-a", "Alpha"),
                new TeamTarget(HUB_ID, "team-b", "Beta")));
        when(syncRunService.startRun(eq(HUB_ID), eq(SyncRun.RunType.FULL_SYNC), eq(RunTrigger.MANUAL), anyString()))
                .thenReturn(run(7L));
        when(tokenService.getToken()).thenReturn("lin_api_token");
        when(mirrorSyncService.syncTeam("lin_api_token", "team-a", "Alpha"))
                .thenReturn(TeamSyncResult.builder().teamId("team-a").success(false).errors(1)
                        .errorMessage("Linear API error").build());
        when(mirrorSyncService.syncTeam("lin_api_token", "team-b", "Beta"))
                .thenReturn(TeamSyncResult.builder().teamId("team-b").success(true).projects(1).issues(3).comments(5).build());

        // WHEN
        HubSyncResult result = orchestrator.syncHub(HUB_ID, RunTrigger.MANUAL);

        // THEN: the run finishes with one error and team-b's rows
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSyncRunId()).isEqualTo(7L);
        assertThat(result.getTeams()).hasSize(2);
        assertThat(result.getCounts().getErrors()).isEqualTo(1);
        assertThat(result.getCounts().getIssues()).isEqualTo(3);
        assertThat(result.getCounts().getComments()).isEqualTo(5);
        assertThat(result.getCorrelationId()).startsWith("SYNC-");

        verify(mirrorSyncService).syncOrgLevel(eq("lin_api_token"), isNull(), any(SyncCounts.class));
        ArgumentCaptor<SyncCounts> counts = ArgumentCaptor.forClass(SyncCounts.class);
        verify(syncRunService).finishRun(eq(7L), counts.capture());
        assertThat(counts.getValue().getErrors()).isEqualTo(1);
    }

    @Test
    void testSyncHub_NoToken_RunFailedWithoutTeamWork() {
        when(targetResolver.teamsOfHub(HUB_ID)).thenReturn(List.of(new TeamTarget(HUB_ID, "team-a", "Alpha")));
        when(syncRunService.startRun(eq(HUB_ID), any(), any(), anyString())).thenReturn(run(8L));
        when(tokenService.getToken()).thenThrow(new WorkspaceNotConnectedException());

        HubSyncResult result = orchestrator.syncHub(HUB_ID, RunTrigger.MANUAL);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCounts().getErrors()).isEqualTo(1);
        assertThat(result.getErrorMessage()).contains("No Linear API token");
        verify(syncRunService).failRun(eq(8L), anyString());
        verify(syncRunService, never()).finishRun(any(), any());
        verifyNoInteractions(mirrorSyncService);
    }

    @Test
    void testSyncHub_HubWithoutTeams_RejectedBeforeRunIsRecorded() {
        when(targetResolver.teamsOfHub(HUB_ID)).thenThrow(ValidationException.noTeamsConfigured());

        assertThatThrownBy(() -> orchestrator.syncHub(HUB_ID, RunTrigger.MANUAL))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(syncRunService, tokenService, mirrorSyncService);
    }

    @Test
    void testSyncAllHubs_TeamSharedByTwoHubs_FetchedOnce() {
        Map<UUID, List<TeamTarget>> byHub = new LinkedHashMap<>();
        byHub.put(HUB_ID, List.of(new TeamTarget(HUB_ID, "team-a", "Alpha")));
        byHub.put(OTHER_HUB_ID, List.of(
                new TeamTarget(OTHER_HUB_ID, "team-a", "Alpha"),
                new TeamTarget(OTHER_HUB_ID, "team-c", "Gamma")));
        when(targetResolver.teamsByActiveHub()).thenReturn(byHub);
        when(syncRunService.startRun(isNull(), eq(SyncRun.RunType.FULL_SYNC), eq(RunTrigger.MANUAL), anyString()))
                .thenReturn(run(9L));
        when(tokenService.getToken()).thenReturn("lin_api_token");
        when(mirrorSyncService.syncTeam(eq("lin_api_token"), anyString(), anyString()))
                .thenReturn(TeamSyncResult.builder().success(true).issues(2).build());

        WorkspaceSyncResult result = orchestrator.syncAllHubs(RunTrigger.MANUAL);

        assertThat(result.getHubs()).isEqualTo(2);
        assertThat(result.getTeams()).isEqualTo(2);
        assertThat(result.getCounts().getIssues()).isEqualTo(4);
        verify(mirrorSyncService, times(1)).syncTeam("lin_api_token", "team-a", "Alpha");
        verify(mirrorSyncService, times(1)).syncTeam("lin_api_token", "team-c", "Gamma");
        verify(syncRunService).finishRun(eq(9L), any(SyncCounts.class));
    }

    private static SyncRun run(Long id) {
        return SyncRun.builder().id(id).build();
    }
}
