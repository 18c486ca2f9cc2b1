package com.example.hubsyncservice.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Field extraction that works on both upstream shapes: GraphQL query results
 * ({@code team { id }}, {@code labels { nodes [...] }}) and webhook data
 * ({@code teamId}, {@code labels [...]}).
 */
public final class UpstreamPayloads {

    private UpstreamPayloads() {
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    /**
     * {@code <field>Id} when present, else {@code <field>.id}.
     */
    public static String refId(JsonNode node, String field) {
        String flat = text(node, field + "Id");
        if (flat != null) {
            return flat;
        }
        return text(node.path(field), "id");
    }

    public static String nestedName(JsonNode node, String field) {
        return text(node.path(field), "name");
    }

    public static String issueTeamId(JsonNode issue) {
        return refId(issue, "team");
    }

    /**
     * Team of the issue a comment belongs to, when the comment payload carries it.
     */
    public static String commentTeamId(JsonNode comment) {
        return issueTeamId(comment.path("issue"));
    }

    public static String commentIssueId(JsonNode comment) {
        return refId(comment, "issue");
    }

    /**
     * Teams of a project: {@code teamIds [...]}, {@code teams [...]} or {@code teams { nodes [...] }}.
     * Empty when the payload does not say.
     */
    public static List<String> projectTeamIds(JsonNode project) {
        Set<String> ids = new LinkedHashSet<>();
        project.path("teamIds").forEach(id -> {
            if (id.isTextual()) {
                ids.add(id.asText());
            }
        });
        for (JsonNode team : connectionNodes(project.path("teams"))) {
            String id = text(team, "id");
            if (id != null) {
                ids.add(id);
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * Labels as a flat list regardless of shape.
     */
    public static List<JsonNode> labels(JsonNode issue) {
        return connectionNodes(issue.path("labels"));
    }

    public static List<String> labelIds(JsonNode issue) {
        List<String> ids = new ArrayList<>();
        for (JsonNode label : labels(issue)) {
            String id = text(label, "id");
            if (id != null) {
                ids.add(id);
            }
        }
        if (ids.isEmpty()) {
            issue.path("labelIds").forEach(id -> ids.add(id.asText()));
        }
        return ids;
    }

    static List<JsonNode> connectionNodes(JsonNode value) {
        List<JsonNode> nodes = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(nodes::add);
        } else if (value.path("nodes").isArray()) {
            value.path("nodes").forEach(nodes::add);
        }
        return nodes;
    }
}
