package com.example.hubsyncservice.client.external;

import com.example.hubsyncservice.exception.UpstreamApiException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the Linear GraphQL API.
 *
 * Reads are cursor-paginated: every fetch loops while {@code pageInfo.hasNextPage} is true and
 * returns the complete, ordered node list for its scope. Entities are returned as raw JSON so the
 * mirror can keep the upstream payload verbatim.
 *
 * Any failure on any page aborts the whole fetch; nothing partial is returned.
 */
@Component
@Slf4j
public class LinearClient {

    private static final int LIVE_READ_LIMIT = 50;

    private final LinearGraphQlTransport transport;
    private final int pageSize;

    public LinearClient(LinearGraphQlTransport transport,
                        @Value("${linear.api.page-size:50}") int pageSize) {
        this.transport = transport;
        this.pageSize = pageSize;
    }

    // ---- org-level scopes ----

    public List<JsonNode> fetchTeams(String token, Instant since) {
        return fetchAll(token, LinearQueries.TEAMS, filterVariables(updatedSince(since)), "teams");
    }

    public List<JsonNode> fetchInitiatives(String token, Instant since) {
        return fetchAll(token, LinearQueries.INITIATIVES, filterVariables(updatedSince(since)), "initiatives");
    }

    // ---- team scopes ----

    public List<JsonNode> fetchProjects(String token, String teamId, Instant since) {
        Map<String, Object> variables = filterVariables(updatedSince(since));
        variables.put("teamId", teamId);
        return fetchAll(token, LinearQueries.TEAM_PROJECTS, variables, "team", "projects");
    }

    public List<JsonNode> fetchCycles(String token, String teamId, Instant since) {
        Map<String, Object> variables = filterVariables(updatedSince(since));
        variables.put("teamId", teamId);
        return fetchAll(token, LinearQueries.TEAM_CYCLES, variables, "team", "cycles");
    }

    public List<JsonNode> fetchIssues(String token, String teamId, Instant since) {
        Map<String, Object> filter = updatedSince(since);
        filter.put("team", eq(teamId));
        return fetchAll(token, LinearQueries.ISSUES, filterVariables(filter), "issues");
    }

    public List<JsonNode> fetchComments(String token, String issueId) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("issue", eq(issueId));
        return fetchAll(token, LinearQueries.COMMENTS, filterVariables(filter), "comments");
    }

    /**
     * Comments on any issue of the team, changed since the watermark.
     */
    public List<JsonNode> fetchCommentsForTeam(String token, String teamId, Instant since) {
        Map<String, Object> filter = updatedSince(since);
        filter.put("issue", Map.of("team", eq(teamId)));
        return fetchAll(token, LinearQueries.COMMENTS, filterVariables(filter), "comments");
    }

    // ---- live reads (not mirrored) ----

    /**
     * Latest history entries of one issue, as returned upstream (no paging).
     *
     * @throws UpstreamApiException also when the issue does not exist upstream
     */
    public List<JsonNode> fetchIssueHistory(String token, String issueId) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("issueId", issueId);
        variables.put("first", LIVE_READ_LIMIT);
        JsonNode issue = transport.execute(token, LinearQueries.ISSUE_HISTORY, variables).path("issue");
        if (!issue.isObject()) {
            throw new UpstreamApiException("Linear returned no issue " + issueId);
        }
        List<JsonNode> nodes = new ArrayList<>();
        issue.path("history").path("nodes").forEach(nodes::add);
        return nodes;
    }

    /**
     * The project ({@code id}, {@code name}) with its latest {@code projectUpdates}.
     */
    public JsonNode fetchProjectUpdates(String token, String projectId) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("projectId", projectId);
        variables.put("first", LIVE_READ_LIMIT);
        JsonNode project = transport.execute(token, LinearQueries.PROJECT_UPDATES, variables).path("project");
        if (!project.isObject()) {
            throw new UpstreamApiException("Linear returned no project " + projectId);
        }
        return project;
    }

    // ---- mutations ----

    public JsonNode createComment(String token, String issueId, String body) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("issueId", issueId);
        variables.put("body", body);
        JsonNode result = transport.execute(token, LinearQueries.COMMENT_CREATE, variables).path("commentCreate");
        return requireSuccess(result, "commentCreate").path("comment");
    }

    public JsonNode updateIssueLabels(String token, String issueId, List<String> labelIds) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("issueId", issueId);
        variables.put("labelIds", labelIds);
        JsonNode result = transport.execute(token, LinearQueries.ISSUE_UPDATE_LABELS, variables).path("issueUpdate");
        return requireSuccess(result, "issueUpdate").path("issue");
    }

    /**
     * @param input {@code IssueCreateInput} fields (teamId, title, description, labelIds, projectId, priority)
     */
    public JsonNode createIssue(String token, Map<String, Object> input) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("input", input);
        JsonNode result = transport.execute(token, LinearQueries.ISSUE_CREATE, variables).path("issueCreate");
        return requireSuccess(result, "issueCreate").path("issue");
    }

    /**
     * Register a workspace-wide webhook.
     *
     * @return upstream webhook id
     */
    public String createWebhook(String token, String url, String secret, List<String> resourceTypes) {
        Map<String, Object> input = new HashMap<>();
        input.put("url", url);
        input.put("secret", secret);
        input.put("resourceTypes", resourceTypes);
        input.put("allPublicTeams", true);
        input.put("label", "hub-sync");

        Map<String, Object> variables = new HashMap<>();
        variables.put("input", input);
        JsonNode result = transport.execute(token, LinearQueries.WEBHOOK_CREATE, variables).path("webhookCreate");
        String webhookId = requireSuccess(result, "webhookCreate").path("webhook").path("id").asText(null);
        if (webhookId == null) {
            throw UpstreamApiException.mutationFailed("webhookCreate");
        }
        return webhookId;
    }

    public void updateWebhookSecret(String token, String webhookId, String secret) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("id", webhookId);
        variables.put("input", Map.of("secret", secret));
        requireSuccess(transport.execute(token, LinearQueries.WEBHOOK_UPDATE, variables).path("webhookUpdate"),
                "webhookUpdate");
    }

    public void deleteWebhook(String token, String webhookId) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("id", webhookId);
        requireSuccess(transport.execute(token, LinearQueries.WEBHOOK_DELETE, variables).path("webhookDelete"),
                "webhookDelete");
    }

    // ---- pagination ----

    /**
     * Follow the connection at {@code connectionPath} until the last page.
     */
    List<JsonNode> fetchAll(String token, String query, Map<String, Object> variables, String... connectionPath) {
        List<JsonNode> nodes = new ArrayList<>();
        String cursor = null;
        int pages = 0;

        while (true) {
            Map<String, Object> pageVariables = new HashMap<>(variables);
            pageVariables.put("first", pageSize);
            pageVariables.put("after", cursor);

            JsonNode connection = transport.execute(token, query, pageVariables);
            for (String field : connectionPath) {
                connection = connection.path(field);
            }
            if (connection.isMissingNode() || connection.isNull()) {
                throw new UpstreamApiException("Linear response has no " + String.join(".", connectionPath));
            }

            connection.path("nodes").forEach(nodes::add);
            pages++;

            JsonNode pageInfo = connection.path("pageInfo");
            if (!pageInfo.path("hasNextPage").asBoolean(false)) {
                break;
            }
            String next = pageInfo.path("endCursor").asText(null);
            if (next == null || next.equals(cursor)) {
                throw new UpstreamApiException("Linear reported another page of "
                        + String.join(".", connectionPath) + " without a new cursor");
            }
            cursor = next;
        }

        log.debug("Fetched {} {} in {} page(s)", nodes.size(), connectionPath[connectionPath.length - 1], pages);
        return nodes;
    }

    private JsonNode requireSuccess(JsonNode result, String mutation) {
        if (!result.path("success").asBoolean(false)) {
            throw UpstreamApiException.mutationFailed(mutation);
        }
        return result;
    }

    private static Map<String, Object> filterVariables(Map<String, Object> filter) {
        Map<String, Object> variables = new HashMap<>();
        if (!filter.isEmpty()) {
            variables.put("filter", filter);
        }
        return variables;
    }

    private static Map<String, Object> updatedSince(Instant since) {
        Map<String, Object> filter = new LinkedHashMap<>();
        if (since != null) {
            filter.put("updatedAt", Map.of("gte", since.toString()));
        }
        return filter;
    }

    private static Map<String, Object> eq(String id) {
        return Map.of("id", Map.of("eq", id));
    }
}
