package com.example.hubsyncservice.webhook;

import com.example.hubsyncservice.cache.TeamHubMappingCache;
import com.example.hubsyncservice.entity.SyncedComment;
import com.example.hubsyncservice.entity.SyncedIssue;
import com.example.hubsyncservice.metrics.SyncMetrics;
import com.example.hubsyncservice.repository.MirrorBatchUpserter;
import com.example.hubsyncservice.repository.MirrorTable;
import com.example.hubsyncservice.repository.SyncedIssueRepository;
import com.example.hubsyncservice.service.MirrorRowMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookEventRouterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private TeamHubMappingCache mappingCache;

    @Mock
    private MirrorBatchUpserter upserter;

    @Mock
    private SyncedIssueRepository issueRepository;

    private SyncMetrics syncMetrics;
    private WebhookEventRouter router;

    @BeforeEach
    void setUp() {
        syncMetrics = new SyncMetrics(new SimpleMeterRegistry());
        MirrorRowMapper rowMapper = new MirrorRowMapper(objectMapper,
                Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC), syncMetrics, "workspace");
        router = new WebhookEventRouter(mappingCache, rowMapper, upserter, issueRepository, syncMetrics, "workspace");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testIssueOfTrackedTeam_Upserted() throws Exception {
        when(mappingCache.isTeamTracked("team-a")).thenReturn(true);

        WebhookOutcome outcome = router.route(event("""
                {"action":"update","type":"Issue","data":{"id":"issue-1","identifier":"ALPHA-1","title":"Fix login",
                 "teamId":"team-a","labels":[{"id":"l-1","name":"bug"}],"updatedAt":"2026-02-28T10:00:00.000Z"}}
                """));

        assertThat(outcome).isEqualTo(WebhookOutcome.PROCESSED);
        ArgumentCaptor<List<SyncedIssue>> rows = ArgumentCaptor.forClass(List.class);
        verify(upserter).upsert(eq(MirrorTable.ISSUES), rows.capture());
        assertThat(rows.getValue()).singleElement().satisfies(row -> {
            assertThat(row.getLinearId()).isEqualTo("issue-1");
            assertThat(row.getTeamId()).isEqualTo("team-a");
            assertThat(row.getIdentifier()).isEqualTo("ALPHA-1");
        });
    }

    @Test
    void testIssueOfUntrackedTeam_DroppedWithoutWrite() throws Exception {
        when(mappingCache.isTeamTracked("team-z")).thenReturn(false);

        WebhookOutcome outcome = router.route(event("""
                {"action":"create","type":"Issue","data":{"id":"issue-9","team":{"id":"team-z"}}}
                """));

        assertThat(outcome).isEqualTo(WebhookOutcome.DROPPED_UNTRACKED);
        verifyNoInteractions(upserter);
    }

    @Test
    void testIssueMovedToUntrackedTeam_MirroredRowDeleted() throws Exception {
        // GIVEN: issue-1 is mirrored under team-a and now reported in team-z
        SyncedIssue mirrored = SyncedIssue.builder().workspaceId("workspace").linearId("issue-1").teamId("team-a").build();
        when(issueRepository.findByWorkspaceIdAndLinearId("workspace", "issue-1")).thenReturn(Optional.of(mirrored));
        when(mappingCache.isTeamTracked("team-z")).thenReturn(false);
        when(mappingCache.isTeamTracked("team-a")).thenReturn(true);

        // WHEN
        WebhookOutcome outcome = router.route(event("""
                {"action":"update","type":"Issue","data":{"id":"issue-1","team":{"id":"team-z"}}}
                """));

        // THEN
        assertThat(outcome).isEqualTo(WebhookOutcome.PROCESSED);
        verify(upserter).deleteByNaturalKey(MirrorTable.ISSUES, "workspace", "issue-1");
        verify(upserter, never()).upsert(eq(MirrorTable.ISSUES), anyList());
    }

    @Test
    void testIssueUpdateInUntrackedTeam_NotMirrored_Dropped() throws Exception {
        when(mappingCache.isTeamTracked("team-z")).thenReturn(false);
        when(issueRepository.findByWorkspaceIdAndLinearId("workspace", "issue-9")).thenReturn(Optional.empty());

        WebhookOutcome outcome = router.route(event("""
                {"action":"update","type":"Issue","data":{"id":"issue-9","team":{"id":"team-z"}}}
                """));

        assertThat(outcome).isEqualTo(WebhookOutcome.DROPPED_UNTRACKED);
        verifyNoInteractions(upserter);
    }

    @Test
    void testIssueRemove_DeletesByNaturalKey() throws Exception {
        when(mappingCache.isTeamTracked("team-a")).thenReturn(true);

        WebhookOutcome outcome = router.route(event("""
                {"action":"remove","type":"Issue","data":{"id":"issue-1","teamId":"team-a"}}
                """));

        assertThat(outcome).isEqualTo(WebhookOutcome.PROCESSED);
        verify(upserter).deleteByNaturalKey(MirrorTable.ISSUES, "workspace", "issue-1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCommentWithoutTeam_ResolvedThroughMirroredParentIssue() throws Exception {
        SyncedIssue parent = SyncedIssue.builder().workspaceId("workspace").linearId("issue-1").teamId("team-a").build();
        when(issueRepository.findByWorkspaceIdAndLinearId("workspace", "issue-1")).thenReturn(Optional.of(parent));
        when(mappingCache.isTeamTracked("team-a")).thenReturn(true);

        WebhookOutcome outcome = router.route(event("""
                {"action":"create","type":"Comment","data":{"id":"c-1","body":"Looks good","issueId":"issue-1"}}
                """));

        assertThat(outcome).isEqualTo(WebhookOutcome.PROCESSED);
        ArgumentCaptor<List<SyncedComment>> rows = ArgumentCaptor.forClass(List.class);
        verify(upserter).upsert(eq(MirrorTable.COMMENTS), rows.capture());
        assertThat(rows.getValue().get(0).getIssueLinearId()).isEqualTo("issue-1");
    }

    @Test
    void testCommentWithUnresolvableTeam_Dropped() throws Exception {
        when(issueRepository.findByWorkspaceIdAndLinearId("workspace", "issue-unknown")).thenReturn(Optional.empty());

        WebhookOutcome outcome = router.route(event("""
                {"action":"create","type":"Comment","data":{"id":"c-2","issueId":"issue-unknown"}}
                """));

        assertThat(outcome).isEqualTo(WebhookOutcome.DROPPED_UNTRACKED);
        verifyNoInteractions(upserter);
    }

    @Test
    void testProject_KeptWhenAnyTeamTrackedOrNoTeamInfo() throws Exception {
        when(mappingCache.isTeamTracked("team-z")).thenReturn(false);
        when(mappingCache.isTeamTracked("team-a")).thenReturn(true);

        assertThat(router.route(event("""
                {"action":"update","type":"Project","data":{"id":"p-1","name":"Launch","teamIds":["team-z","team-a"]}}
                """))).isEqualTo(WebhookOutcome.PROCESSED);
        assertThat(router.route(event("""
                {"action":"update","type":"Project","data":{"id":"p-2","name":"Orphan"}}
                """))).isEqualTo(WebhookOutcome.PROCESSED);
        assertThat(router.route(event("""
                {"action":"update","type":"Project","data":{"id":"p-3","teamIds":["team-z"]}}
                """))).isEqualTo(WebhookOutcome.DROPPED_UNTRACKED);
    }

    @Test
    void testInitiative_AlwaysApplied() throws Exception {
        WebhookOutcome outcome = router.route(event("""
                {"action":"update","type":"Initiative","data":{"id":"init-1","name":"H1 goals","status":"Active"}}
                """));

        assertThat(outcome).isEqualTo(WebhookOutcome.PROCESSED);
        verify(upserter).upsert(eq(MirrorTable.INITIATIVES), anyList());
        verifyNoInteractions(mappingCache);
    }

    @Test
    void testUnknownTypeOrActionOrMissingId_Ignored() throws Exception {
        assertThat(router.route(event("""
                {"action":"create","type":"Reaction","data":{"id":"r-1"}}
                """))).isEqualTo(WebhookOutcome.IGNORED);
        assertThat(router.route(event("""
                {"action":"archive","type":"Issue","data":{"id":"issue-1"}}
                """))).isEqualTo(WebhookOutcome.IGNORED);
        assertThat(router.route(event("""
                {"action":"update","type":"Issue","data":{"title":"no id"}}
                """))).isEqualTo(WebhookOutcome.IGNORED);
        verifyNoInteractions(upserter);
    }

    @Test
    void testHandlerFailure_ReportedAsFailedNotThrown() throws Exception {
        when(mappingCache.isTeamTracked("team-a")).thenReturn(true);
        when(upserter.upsert(eq(MirrorTable.ISSUES), anyList())).thenThrow(new IllegalStateException("db down"));

        WebhookOutcome outcome = router.route(event("""
                {"action":"update","type":"Issue","data":{"id":"issue-1","teamId":"team-a"}}
                """));

        assertThat(outcome).isEqualTo(WebhookOutcome.FAILED);
    }

    private WebhookEvent event(String json) throws Exception {
        return WebhookEvent.from(objectMapper.readTree(json));
    }
}
