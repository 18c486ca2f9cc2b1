package com.example.hubsyncservice.service;

import com.example.hubsyncservice.client.external.LinearClient;
import com.example.hubsyncservice.dto.response.IssueHistoryEntryDto;
import com.example.hubsyncservice.dto.response.IssueHistoryEntryDto.ChangeType;
import com.example.hubsyncservice.dto.response.IssueHistoryResponse;
import com.example.hubsyncservice.dto.response.LabelDto;
import com.example.hubsyncservice.dto.response.ProjectUpdatesResponse;
import com.example.hubsyncservice.dto.response.StateDto;
import com.example.hubsyncservice.entity.SyncedIssue;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Hub-scoped reads that go straight to the upstream API because the data is not mirrored:
 * issue history and project updates.
 *
 * CRITICAL DESIGN:
 * - Visibility is checked against the mirror BEFORE the upstream call
 * - Assignee changes are never requested, so they cannot leak
 * - Upstream failures propagate as UpstreamApiException (502)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HubLiveReadService {

    private final HubReadService readService;
    private final WorkspaceTokenService tokenService;
    private final LinearClient linearClient;

    /**
     * State, priority and label changes of a visible issue, oldest first. Label changes are
     * trimmed to the labels the hub may see; an entry left without labels is dropped.
     */
    public IssueHistoryResponse issueHistory(UUID hubId, String issueId) {
        SyncedIssue issue = readService.requireVisibleIssue(hubId, issueId);
        HubVisibility visibility = readService.visibility(hubId);

        List<IssueHistoryEntryDto> entries = new ArrayList<>();
        for (JsonNode node : linearClient.fetchIssueHistory(tokenService.getToken(), issueId)) {
            IssueHistoryEntryDto entry = toEntry(node, label -> visibility.isLabelVisible(issue.getTeamId(), label));
            if (entry != null) {
                entries.add(entry);
            }
        }
        entries.sort(Comparator.comparing(IssueHistoryEntryDto::createdAt,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return IssueHistoryResponse.of(entries);
    }

    /**
     * Updates of a project the hub may see, newest first.
     *
     * @throws ResourceNotFoundException when the hub has no mappings or the project is outside
     *                                   its project allow-list
     */
    public ProjectUpdatesResponse projectUpdates(UUID hubId, String projectId) {
        HubVisibility visibility = readService.visibility(hubId);
        if (visibility.isEmpty() || !visibility.isProjectVisible(projectId)) {
            throw ResourceNotFoundException.project(projectId);
        }

        JsonNode project = linearClient.fetchProjectUpdates(tokenService.getToken(), projectId);
        List<ProjectUpdatesResponse.Update> updates = new ArrayList<>();
        for (JsonNode node : UpstreamPayloads.connectionNodes(project.path("projectUpdates"))) {
            updates.add(new ProjectUpdatesResponse.Update(
                    UpstreamPayloads.text(node, "id"),
                    UpstreamPayloads.text(node, "body"),
                    UpstreamPayloads.text(node, "health"),
                    instant(node, "createdAt"),
                    instant(node, "updatedAt")));
        }
        updates.sort(Comparator.comparing(ProjectUpdatesResponse.Update::createdAt,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return new ProjectUpdatesResponse(projectId, UpstreamPayloads.text(project, "name"), updates);
    }

    private IssueHistoryEntryDto toEntry(JsonNode node, Predicate<String> labelVisible) {
        String id = UpstreamPayloads.text(node, "id");
        Instant createdAt = instant(node, "createdAt");

        StateDto fromState = state(node.path("fromState"));
        StateDto toState = state(node.path("toState"));
        if (fromState != null || toState != null) {
            return new IssueHistoryEntryDto(id, createdAt, ChangeType.STATE, fromState, toState, null, null, null, null);
        }

        Integer fromPriority = priority(node.path("fromPriority"));
        Integer toPriority = priority(node.path("toPriority"));
        if (fromPriority != null || toPriority != null) {
            if (Objects.equals(fromPriority, toPriority)) {
                return null;
            }
            return new IssueHistoryEntryDto(id, createdAt, ChangeType.PRIORITY, null, null, fromPriority, toPriority, null, null);
        }

        List<LabelDto> added = labels(node.path("addedLabels"), labelVisible);
        List<LabelDto> removed = labels(node.path("removedLabels"), labelVisible);
        if (!added.isEmpty() || !removed.isEmpty()) {
            return new IssueHistoryEntryDto(id, createdAt, ChangeType.LABEL, null, null, null, null,
                    added.isEmpty() ? null : added, removed.isEmpty() ? null : removed);
        }
        return null;
    }

    private static StateDto state(JsonNode state) {
        if (!state.isObject()) {
            return null;
        }
        return new StateDto(UpstreamPayloads.text(state, "id"), UpstreamPayloads.text(state, "name"),
                UpstreamPayloads.text(state, "color"), UpstreamPayloads.text(state, "type"));
    }

    private static Integer priority(JsonNode value) {
        return value.isNumber() ? value.asInt() : null;
    }

    private static List<LabelDto> labels(JsonNode connection, Predicate<String> labelVisible) {
        List<LabelDto> labels = new ArrayList<>();
        for (JsonNode label : UpstreamPayloads.connectionNodes(connection)) {
            String labelId = UpstreamPayloads.text(label, "id");
            if (labelId != null && labelVisible.test(labelId)) {
                labels.add(new LabelDto(labelId, UpstreamPayloads.text(label, "name"), UpstreamPayloads.text(label, "color")));
            }
        }
        return labels;
    }

    private static Instant instant(JsonNode node, String field) {
        String raw = UpstreamPayloads.text(node, field);
        if (raw == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Unparseable {} in live read: [{}]", field, raw);
            return null;
        }
    }
}
