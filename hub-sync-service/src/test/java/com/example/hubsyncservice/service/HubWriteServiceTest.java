package com.example.hubsyncservice.service;

import com.example.hubsyncservice.client.external.LinearClient;
import com.example.hubsyncservice.dto.request.CreateIssueRequest;
import com.example.hubsyncservice.dto.response.HubIssueDetailDto;
import com.example.hubsyncservice.dto.response.HubIssueDto;
import com.example.hubsyncservice.entity.SyncedIssue;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.exception.ValidationException;
import com.example.hubsyncservice.metrics.SyncMetrics;
import com.example.hubsyncservice.repository.MirrorBatchUpserter;
import com.example.hubsyncservice.repository.MirrorTable;
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
import java.util.Map;
import java.util.UUID;

import static com.example.hubsyncservice.service.HubVisibilityTest.mapping;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HubWriteServiceTest {

    private static final UUID HUB_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private HubReadService readService;

    @Mock
    private WorkspaceTokenService tokenService;

    @Mock
    private LinearClient linearClient;

    @Mock
    private MirrorBatchUpserter upserter;

    private HubWriteService writeService;

    @BeforeEach
    void setUp() {
        MirrorRowMapper rowMapper = new MirrorRowMapper(objectMapper,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC),
                new SyncMetrics(new SimpleMeterRegistry()), "workspace");
        writeService = new HubWriteService(readService, tokenService, linearClient, rowMapper, upserter, objectMapper);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCreateIssue_DropsLabelsOutsideMappingAndMirrorsResult() throws Exception {
        // GIVEN: team-a allows label-bug only and hides label-secret
        when(readService.visibility(HUB_ID)).thenReturn(new HubVisibility(List.of(
                mapping("team-a", List.of(), List.of("label-bug"), List.of("label-secret")))));
        when(tokenService.getToken()).thenReturn("lin_api_token");
        when(linearClient.createIssue(eq("lin_api_token"), anyMap()))
                .thenReturn(objectMapper.readTree("""
                        {"id":"issue-7","identifier":"ALPHA-7","title":"Broken export","team":{"id":"team-a"}}
                        """));
        HubIssueDto dto = issueDto("issue-7");
        when(readService.getIssue(HUB_ID, "issue-7")).thenReturn(new HubIssueDetailDto(dto, List.of()));

        // WHEN
        HubIssueDto result = writeService.createIssue(HUB_ID, new CreateIssueRequest(
                "team-a", "Broken export", null, null, List.of("label-bug", "label-secret", "label-ux"), 2));

        // THEN
        assertThat(result).isSameAs(dto);
        ArgumentCaptor<Map<String, Object>> input = ArgumentCaptor.forClass(Map.class);
        verify(linearClient).createIssue(eq("lin_api_token"), input.capture());
        assertThat(input.getValue())
                .containsEntry("teamId", "team-a")
                .containsEntry("labelIds", List.of("label-bug"))
                .containsEntry("priority", 2)
                .doesNotContainKey("projectId");

        ArgumentCaptor<List<SyncedIssue>> rows = ArgumentCaptor.forClass(List.class);
        verify(upserter).upsert(eq(MirrorTable.ISSUES), rows.capture());
        assertThat(rows.getValue()).extracting(SyncedIssue::getLinearId).containsExactly("issue-7");
    }

    @Test
    void testCreateIssue_UnmappedTeam_NotFound() {
        when(readService.visibility(HUB_ID)).thenReturn(new HubVisibility(List.of(
                mapping("team-a", List.of(), List.of(), List.of()))));

        assertThatThrownBy(() -> writeService.createIssue(HUB_ID,
                new CreateIssueRequest("team-b", "Title", null, null, null, null)))
                .isInstanceOf(ResourceNotFoundException.class);

        verifyNoInteractions(linearClient, upserter);
    }

    @Test
    void testCreateIssue_ProjectAllowListWithoutProject_Rejected() {
        when(readService.visibility(HUB_ID)).thenReturn(new HubVisibility(List.of(
                mapping("team-a", List.of("proj-1"), List.of(), List.of()))));

        assertThatThrownBy(() -> writeService.createIssue(HUB_ID,
                new CreateIssueRequest("team-a", "Title", null, null, null, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> writeService.createIssue(HUB_ID,
                new CreateIssueRequest("team-a", "Title", null, "proj-2", null, null)))
                .isInstanceOf(ResourceNotFoundException.class);

        verifyNoInteractions(linearClient);
    }

    @Test
    void testAddLabel_HiddenLabel_Rejected() {
        SyncedIssue issue = SyncedIssue.builder().linearId("issue-1").teamId("team-a").payload("{}").build();
        when(readService.requireVisibleIssue(HUB_ID, "issue-1")).thenReturn(issue);
        when(readService.visibility(HUB_ID)).thenReturn(new HubVisibility(List.of(
                mapping("team-a", List.of(), List.of(), List.of("label-secret")))));

        assertThatThrownBy(() -> writeService.addLabel(HUB_ID, "issue-1", "label-secret"))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(linearClient);
    }

    @Test
    void testAddLabel_SendsFullLabelSet() throws Exception {
        SyncedIssue issue = SyncedIssue.builder().linearId("issue-1").teamId("team-a")
                .payload("{\"labels\":{\"nodes\":[{\"id\":\"label-bug\"}]}}").build();
        when(readService.requireVisibleIssue(HUB_ID, "issue-1")).thenReturn(issue);
        when(readService.visibility(HUB_ID)).thenReturn(new HubVisibility(List.of(
                mapping("team-a", List.of(), List.of(), List.of()))));
        when(tokenService.getToken()).thenReturn("lin_api_token");
        when(linearClient.updateIssueLabels("lin_api_token", "issue-1", List.of("label-bug", "label-ux")))
                .thenReturn(objectMapper.readTree("{\"id\":\"issue-1\",\"team\":{\"id\":\"team-a\"}}"));
        when(readService.getIssue(HUB_ID, "issue-1"))
                .thenReturn(new HubIssueDetailDto(issueDto("issue-1"), List.of()));

        writeService.addLabel(HUB_ID, "issue-1", "label-ux");

        verify(upserter).upsert(eq(MirrorTable.ISSUES), anyList());
    }

    private static HubIssueDto issueDto(String id) {
        return new HubIssueDto(id, null, null, null, null, null, null, null, "team-a", null, List.of(), null, null);
    }
}
