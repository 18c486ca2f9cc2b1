package com.example.hubsyncservice.controller;

import com.example.hubsyncservice.dto.response.*;
import com.example.hubsyncservice.security.HubAccess;
import com.example.hubsyncservice.security.HubAuthGuard;
import com.example.hubsyncservice.service.HubLiveReadService;
import com.example.hubsyncservice.service.HubReadService;
import com.example.hubsyncservice.service.HubReadService.IssueFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Hub-scoped reads. Every endpoint passes the hub auth guard before touching the mirror.
 */
@RestController
@RequestMapping("/api/hubs/{hubId}")
@RequiredArgsConstructor
public class HubReadController {

    private final HubAuthGuard hubAuthGuard;
    private final HubReadService readService;
    private final HubLiveReadService liveReadService;

    @GetMapping("/me")
    public ResponseEntity<HubMeResponse> me(@PathVariable UUID hubId) {
        HubAccess access = hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(new HubMeResponse(
                hubId,
                access.identity().getId(),
                access.identity().getEmail(),
                access.role().name(),
                access.canWrite()));
    }

    @GetMapping("/issues")
    public ResponseEntity<List<HubIssueDto>> listIssues(
            @PathVariable UUID hubId,
            @RequestParam(required = false) String teamId,
            @RequestParam(required = false) String projectId,
            @RequestParam(name = "state", required = false) List<String> states) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(readService.listIssues(hubId,
                new IssueFilter(teamId, projectId, states == null ? List.of() : states)));
    }

    @GetMapping("/issues/{issueId}")
    public ResponseEntity<HubIssueDetailDto> getIssue(@PathVariable UUID hubId, @PathVariable String issueId) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(readService.getIssue(hubId, issueId));
    }

    @GetMapping("/issues/{issueId}/comments")
    public ResponseEntity<List<HubCommentDto>> listComments(@PathVariable UUID hubId, @PathVariable String issueId) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(readService.listComments(hubId, issueId));
    }

    @GetMapping("/issues/{issueId}/history")
    public ResponseEntity<IssueHistoryResponse> issueHistory(@PathVariable UUID hubId, @PathVariable String issueId) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(liveReadService.issueHistory(hubId, issueId));
    }

    @GetMapping("/teams")
    public ResponseEntity<List<HubTeamDto>> listTeams(@PathVariable UUID hubId) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(readService.listTeams(hubId));
    }

    @GetMapping("/projects")
    public ResponseEntity<List<HubProjectDto>> listProjects(
            @PathVariable UUID hubId,
            @RequestParam(required = false) String state) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(readService.listProjects(hubId, state));
    }

    @GetMapping("/projects/{projectId}/updates")
    public ResponseEntity<ProjectUpdatesResponse> projectUpdates(@PathVariable UUID hubId, @PathVariable String projectId) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(liveReadService.projectUpdates(hubId, projectId));
    }

    @GetMapping("/cycles")
    public ResponseEntity<List<HubCycleDto>> listCycles(
            @PathVariable UUID hubId,
            @RequestParam(required = false) String teamId) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(readService.listCycles(hubId, teamId));
    }

    @GetMapping("/initiatives")
    public ResponseEntity<List<HubInitiativeDto>> listInitiatives(
            @PathVariable UUID hubId,
            @RequestParam(required = false) String status) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(readService.listInitiatives(hubId, status));
    }

    @GetMapping("/metadata")
    public ResponseEntity<HubMetadataDto> metadata(
            @PathVariable UUID hubId,
            @RequestParam(required = false) String teamId,
            @RequestParam(required = false) String projectId) {
        hubAuthGuard.authorize(hubId).orElseThrow();
        return ResponseEntity.ok(readService.metadata(hubId, teamId, projectId));
    }
}
