package com.example.hubsyncservice.service;

import com.example.hubsyncservice.entity.*;
import com.example.hubsyncservice.metrics.SyncMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Converts upstream entities (query results or webhook data) into mirror rows.
 *
 * Deterministic: the same payload always yields the same row, except {@code synced_at}, which
 * is stamped from the injected clock. The payload is kept verbatim; the scalar columns are
 * extracted copies for filtering and sorting.
 */
@Component
@Slf4j
public class MirrorRowMapper {

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SyncMetrics syncMetrics;
    private final String workspaceId;

    public MirrorRowMapper(ObjectMapper objectMapper,
                           Clock clock,
                           SyncMetrics syncMetrics,
                           @Value("${hub.workspace-id:workspace}") String workspaceId) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.syncMetrics = syncMetrics;
        this.workspaceId = workspaceId;
    }

    public SyncedIssue toIssue(JsonNode issue) {
        String id = requireId(issue, "issue");
        return SyncedIssue.builder()
                .workspaceId(workspaceId)
                .linearId(id)
                .identifier(UpstreamPayloads.text(issue, "identifier"))
                .title(UpstreamPayloads.text(issue, "title"))
                .stateName(UpstreamPayloads.nestedName(issue, "state"))
                .priority(issue.path("priority").isNumber() ? issue.path("priority").asInt() : null)
                .assigneeName(UpstreamPayloads.nestedName(issue, "assignee"))
                .teamId(UpstreamPayloads.issueTeamId(issue))
                .projectId(UpstreamPayloads.refId(issue, "project"))
                .payload(serialize(issue))
                .createdAt(parseTimestamp(issue, "createdAt", id))
                .updatedAt(parseTimestamp(issue, "updatedAt", id))
                .syncedAt(clock.instant())
                .build();
    }

    /**
     * @param issueIdFallback parent issue id when the comment payload does not carry it
     *                        (per-issue comment queries)
     */
    public SyncedComment toComment(JsonNode comment, String issueIdFallback) {
        String id = requireId(comment, "comment");
        String issueId = UpstreamPayloads.commentIssueId(comment);
        return SyncedComment.builder()
                .workspaceId(workspaceId)
                .linearId(id)
                .issueLinearId(issueId != null ? issueId : issueIdFallback)
                .authorName(UpstreamPayloads.nestedName(comment, "user"))
                .payload(serialize(comment))
                .createdAt(parseTimestamp(comment, "createdAt", id))
                .updatedAt(parseTimestamp(comment, "updatedAt", id))
                .syncedAt(clock.instant())
                .build();
    }

    public SyncedComment toComment(JsonNode comment) {
        return toComment(comment, null);
    }

    public SyncedTeam toTeam(JsonNode team) {
        String id = requireId(team, "team");
        return SyncedTeam.builder()
                .workspaceId(workspaceId)
                .linearId(id)
                .name(UpstreamPayloads.text(team, "name"))
                .teamKey(UpstreamPayloads.text(team, "key"))
                .parentTeamId(UpstreamPayloads.refId(team, "parent"))
                .payload(serialize(team))
                .createdAt(parseTimestamp(team, "createdAt", id))
                .updatedAt(parseTimestamp(team, "updatedAt", id))
                .syncedAt(clock.instant())
                .build();
    }

    public SyncedProject toProject(JsonNode project) {
        String id = requireId(project, "project");
        JsonNode state = project.path("state");
        return SyncedProject.builder()
                .workspaceId(workspaceId)
                .linearId(id)
                .name(UpstreamPayloads.text(project, "name"))
                .stateName(state.isTextual() ? state.asText() : UpstreamPayloads.text(state, "name"))
                .teamIds(UpstreamPayloads.projectTeamIds(project))
                .payload(serialize(project))
                .createdAt(parseTimestamp(project, "createdAt", id))
                .updatedAt(parseTimestamp(project, "updatedAt", id))
                .syncedAt(clock.instant())
                .build();
    }

    public SyncedCycle toCycle(JsonNode cycle) {
        String id = requireId(cycle, "cycle");
        return SyncedCycle.builder()
                .workspaceId(workspaceId)
                .linearId(id)
                .name(UpstreamPayloads.text(cycle, "name"))
                .number(cycle.path("number").isNumber() ? cycle.path("number").asInt() : null)
                .teamId(UpstreamPayloads.refId(cycle, "team"))
                .startsAt(parseTimestamp(cycle, "startsAt", id))
                .endsAt(parseTimestamp(cycle, "endsAt", id))
                .payload(serialize(cycle))
                .createdAt(parseTimestamp(cycle, "createdAt", id))
                .updatedAt(parseTimestamp(cycle, "updatedAt", id))
                .syncedAt(clock.instant())
                .build();
    }

    public SyncedInitiative toInitiative(JsonNode initiative) {
        String id = requireId(initiative, "initiative");
        return SyncedInitiative.builder()
                .workspaceId(workspaceId)
                .linearId(id)
                .name(UpstreamPayloads.text(initiative, "name"))
                .status(UpstreamPayloads.text(initiative, "status"))
                .payload(serialize(initiative))
                .createdAt(parseTimestamp(initiative, "createdAt", id))
                .updatedAt(parseTimestamp(initiative, "updatedAt", id))
                .syncedAt(clock.instant())
                .build();
    }

    private String requireId(JsonNode node, String kind) {
        String id = UpstreamPayloads.text(node, "id");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Upstream " + kind + " without id");
        }
        return id;
    }

    private String serialize(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize upstream payload", e);
        }
    }

    /**
     * Parse an ISO-8601 timestamp field. Unparseable values are logged with the record id and
     * the raw value, counted as parser warnings and stored as null.
     */
    private Instant parseTimestamp(JsonNode node, String fieldName, String recordId) {
        String raw = UpstreamPayloads.text(node, fieldName);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Failed to parse {}. recordId={} rawValue=[{}]. Stored as null.", fieldName, recordId, raw);
            syncMetrics.recordParserWarning();
            return null;
        }
    }
}
