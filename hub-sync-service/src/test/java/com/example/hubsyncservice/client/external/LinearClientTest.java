package com.example.hubsyncservice.client.external;

import com.example.hubsyncservice.exception.UpstreamApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LinearClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private LinearGraphQlTransport transport;

    private LinearClient linearClient;

    @BeforeEach
    void setUp() {
        linearClient = new LinearClient(transport, 2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFetchIssues_FollowsCursorUntilLastPage() throws Exception {
        // GIVEN: two pages
        when(transport.execute(eq("token"), eq(LinearQueries.ISSUES), anyMap())).thenReturn(
                json("""
                        {"issues":{"nodes":[{"id":"i-1"},{"id":"i-2"}],"pageInfo":{"hasNextPage":true,"endCursor":"c-2"}}}
                        """),
                json("""
                        {"issues":{"nodes":[{"id":"i-3"}],"pageInfo":{"hasNextPage":false,"endCursor":"c-3"}}}
                        """));

        // WHEN
        List<JsonNode> issues = linearClient.fetchIssues("token", "team-a", Instant.parse("2026-03-01T11:50:00Z"));

        // THEN
        assertThat(issues).extracting(node -> node.path("id").asText()).containsExactly("i-1", "i-2", "i-3");

        ArgumentCaptor<Map<String, Object>> variables = ArgumentCaptor.forClass(Map.class);
        verify(transport, times(2)).execute(eq("token"), eq(LinearQueries.ISSUES), variables.capture());
        Map<String, Object> first = variables.getAllValues().get(0);
        Map<String, Object> second = variables.getAllValues().get(1);
        assertThat(first).containsEntry("first", 2).containsEntry("after", null);
        assertThat(second).containsEntry("after", "c-2");
        Map<String, Object> filter = (Map<String, Object>) first.get("filter");
        assertThat(filter).containsEntry("updatedAt", Map.of("gte", "2026-03-01T11:50:00Z"))
                .containsEntry("team", Map.of("id", Map.of("eq", "team-a")));
    }

    @Test
    void testFetchTeams_NoWatermark_NoFilter() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.TEAMS), anyMap())).thenReturn(json("""
                {"teams":{"nodes":[{"id":"team-a"}],"pageInfo":{"hasNextPage":false}}}
                """));

        assertThat(linearClient.fetchTeams("token", null)).hasSize(1);
    }

    @Test
    void testFetchProjects_NestedConnection() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.TEAM_PROJECTS), anyMap())).thenReturn(json("""
                {"team":{"projects":{"nodes":[{"id":"proj-1"}],"pageInfo":{"hasNextPage":false}}}}
                """));

        assertThat(linearClient.fetchProjects("token", "team-a", null))
                .extracting(node -> node.path("id").asText())
                .containsExactly("proj-1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFetchCycles_TeamScopedNestedConnection() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.TEAM_CYCLES), anyMap())).thenReturn(json("""
                {"team":{"cycles":{"nodes":[{"id":"cycle-1","number":1}],"pageInfo":{"hasNextPage":false}}}}
                """));

        List<JsonNode> cycles = linearClient.fetchCycles("token", "team-a", Instant.parse("2026-03-01T00:00:00Z"));

        assertThat(cycles).extracting(node -> node.path("id").asText()).containsExactly("cycle-1");
        ArgumentCaptor<Map<String, Object>> variables = ArgumentCaptor.forClass(Map.class);
        verify(transport).execute(eq("token"), eq(LinearQueries.TEAM_CYCLES), variables.capture());
        assertThat(variables.getValue()).containsEntry("teamId", "team-a").containsKey("filter");
    }

    @Test
    void testFetchIssueHistory_UnknownIssue_Fails() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.ISSUE_HISTORY), anyMap())).thenReturn(json("""
                {"issue":null}
                """));

        assertThatThrownBy(() -> linearClient.fetchIssueHistory("token", "issue-404"))
                .isInstanceOf(UpstreamApiException.class)
                .hasMessageContaining("issue-404");
    }

    @Test
    void testFetchIssueHistory_ReturnsNodes() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.ISSUE_HISTORY), anyMap())).thenReturn(json("""
                {"issue":{"history":{"nodes":[{"id":"h-1"},{"id":"h-2"}]}}}
                """));

        assertThat(linearClient.fetchIssueHistory("token", "issue-1"))
                .extracting(node -> node.path("id").asText())
                .containsExactly("h-1", "h-2");
    }

    @Test
    void testPagination_RepeatedCursor_Aborts() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.COMMENTS), anyMap())).thenReturn(json("""
                {"comments":{"nodes":[],"pageInfo":{"hasNextPage":true,"endCursor":"same"}}}
                """));

        assertThatThrownBy(() -> linearClient.fetchComments("token", "issue-1"))
                .isInstanceOf(UpstreamApiException.class)
                .hasMessageContaining("without a new cursor");
    }

    @Test
    void testPagination_FailureOnLaterPage_NothingReturned() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.TEAMS), anyMap()))
                .thenReturn(json("""
                        {"teams":{"nodes":[{"id":"team-a"}],"pageInfo":{"hasNextPage":true,"endCursor":"c-1"}}}
                        """))
                .thenThrow(UpstreamApiException.httpStatus(500, "boom"));

        assertThatThrownBy(() -> linearClient.fetchTeams("token", null)).isInstanceOf(UpstreamApiException.class);
    }

    @Test
    void testMutation_SuccessFalse_Throws() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.COMMENT_CREATE), any())).thenReturn(json("""
                {"commentCreate":{"success":false}}
                """));

        assertThatThrownBy(() -> linearClient.createComment("token", "issue-1", "hello"))
                .isInstanceOf(UpstreamApiException.class);
    }

    @Test
    void testCreateWebhook_ReturnsUpstreamId() throws Exception {
        when(transport.execute(eq("token"), eq(LinearQueries.WEBHOOK_CREATE), any())).thenReturn(json("""
                {"webhookCreate":{"success":true,"webhook":{"id":"wh-1","enabled":true}}}
                """));

        String webhookId = linearClient.createWebhook("token", "https://hub.example.com/api/webhooks/linear",
                "secret", List.of("Issue", "Comment"));

        assertThat(webhookId).isEqualTo("wh-1");
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
