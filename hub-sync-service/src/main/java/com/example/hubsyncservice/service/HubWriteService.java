package com.example.hubsyncservice.service;

import com.example.hubsyncservice.cache.TeamMappingView;
import com.example.hubsyncservice.client.external.LinearClient;
import com.example.hubsyncservice.dto.request.CreateIssueRequest;
import com.example.hubsyncservice.dto.response.HubCommentDto;
import com.example.hubsyncservice.dto.response.HubIssueDto;
import com.example.hubsyncservice.entity.SyncedComment;
import com.example.hubsyncservice.entity.SyncedIssue;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.exception.ValidationException;
import com.example.hubsyncservice.repository.MirrorBatchUpserter;
import com.example.hubsyncservice.repository.MirrorTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes initiated from a hub: issue creation, comments and label changes.
 *
 * Each operation is checked against the hub's visibility rules, sent upstream, and the entity
 * returned by the mutation is upserted into the mirror straight away so the hub sees its own
 * write before the webhook arrives. Not transactional: the upstream call must not hold a
 * database connection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HubWriteService {

    private final HubReadService readService;
    private final WorkspaceTokenService tokenService;
    private final LinearClient linearClient;
    private final MirrorRowMapper rowMapper;
    private final MirrorBatchUpserter upserter;
    private final ObjectMapper objectMapper;

    public HubIssueDto createIssue(UUID hubId, CreateIssueRequest request) {
        HubVisibility visibility = readService.visibility(hubId);
        TeamMappingView mapping = visibility.mappingFor(request.teamId())
                .orElseThrow(() -> ResourceNotFoundException.team(request.teamId()));

        if (request.projectId() != null) {
            if (!mapping.isProjectVisible(request.projectId())) {
                throw ResourceNotFoundException.project(request.projectId());
            }
        } else if (!mapping.getVisibleProjectIds().isEmpty()) {
            throw ValidationException.projectRequired();
        }

        List<String> labelIds = new ArrayList<>();
        if (request.labelIds() != null) {
            for (String labelId : request.labelIds()) {
                if (isAssignable(mapping, labelId) && !labelIds.contains(labelId)) {
                    labelIds.add(labelId);
                }
            }
        }

        Map<String, Object> input = new HashMap<>();
        input.put("teamId", request.teamId());
        input.put("title", request.title());
        if (request.description() != null) {
            input.put("description", request.description());
        }
        if (request.projectId() != null) {
            input.put("projectId", request.projectId());
        }
        if (!labelIds.isEmpty()) {
            input.put("labelIds", labelIds);
        }
        if (request.priority() != null) {
            input.put("priority", request.priority());
        }

        JsonNode created = linearClient.createIssue(tokenService.getToken(), input);
        SyncedIssue row = rowMapper.toIssue(created);
        upserter.upsert(MirrorTable.ISSUES, List.of(row));
        log.info("✅ Issue {} created from hub {} in team {}", row.getIdentifier(), hubId, request.teamId());

        return readService.getIssue(hubId, row.getLinearId()).issue();
    }

    public HubCommentDto createComment(UUID hubId, String issueId, String body) {
        readService.requireVisibleIssue(hubId, issueId);

        JsonNode created = linearClient.createComment(tokenService.getToken(), issueId, body);
        SyncedComment row = rowMapper.toComment(created, issueId);
        upserter.upsert(MirrorTable.COMMENTS, List.of(row));
        log.info("✅ Comment {} added to issue {} from hub {}", row.getLinearId(), issueId, hubId);

        return new HubCommentDto(row.getLinearId(), UpstreamPayloads.text(created, "body"),
                row.getAuthorName(), row.getCreatedAt(), row.getUpdatedAt());
    }

    public HubIssueDto addLabel(UUID hubId, String issueId, String labelId) {
        SyncedIssue issue = readService.requireVisibleIssue(hubId, issueId);
        TeamMappingView mapping = teamMapping(hubId, issue);
        if (!isAssignable(mapping, labelId)) {
            throw ValidationException.labelNotAllowed(labelId);
        }

        List<String> labelIds = new ArrayList<>(UpstreamPayloads.labelIds(parse(issue.getPayload())));
        if (labelIds.contains(labelId)) {
            return readService.getIssue(hubId, issueId).issue();
        }
        labelIds.add(labelId);
        return updateLabels(hubId, issueId, labelIds);
    }

    public HubIssueDto removeLabel(UUID hubId, String issueId, String labelId) {
        SyncedIssue issue = readService.requireVisibleIssue(hubId, issueId);
        TeamMappingView mapping = teamMapping(hubId, issue);
        if (!mapping.isLabelVisible(labelId)) {
            throw ValidationException.labelNotAllowed(labelId);
        }

        List<String> labelIds = new ArrayList<>(UpstreamPayloads.labelIds(parse(issue.getPayload())));
        if (!labelIds.remove(labelId)) {
            return readService.getIssue(hubId, issueId).issue();
        }
        return updateLabels(hubId, issueId, labelIds);
    }

    private HubIssueDto updateLabels(UUID hubId, String issueId, List<String> labelIds) {
        JsonNode updated = linearClient.updateIssueLabels(tokenService.getToken(), issueId, labelIds);
        upserter.upsert(MirrorTable.ISSUES, List.of(rowMapper.toIssue(updated)));
        log.info("Labels of issue {} updated from hub {}", issueId, hubId);
        return readService.getIssue(hubId, issueId).issue();
    }

    private TeamMappingView teamMapping(UUID hubId, SyncedIssue issue) {
        return readService.visibility(hubId).mappingFor(issue.getTeamId())
                .orElseThrow(() -> ResourceNotFoundException.issue(issue.getLinearId()));
    }

    // A hidden label would take the issue out of the hub's view.
    private static boolean isAssignable(TeamMappingView mapping, String labelId) {
        return labelId != null && mapping.isLabelVisible(labelId) && !mapping.hidesAnyOf(List.of(labelId));
    }

    private JsonNode parse(String payload) {
        try {
            return objectMapper.readTree(payload == null ? "{}" : payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt mirror payload", e);
        }
    }
}
