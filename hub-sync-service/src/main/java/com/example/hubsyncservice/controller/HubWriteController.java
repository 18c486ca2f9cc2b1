package com.example.hubsyncservice.controller;

import com.example.hubsyncservice.dto.request.CreateCommentRequest;
import com.example.hubsyncservice.dto.request.CreateIssueRequest;
import com.example.hubsyncservice.dto.request.LabelRequest;
import com.example.hubsyncservice.dto.response.HubCommentDto;
import com.example.hubsyncservice.dto.response.HubIssueDto;
import com.example.hubsyncservice.security.HubAccess;
import com.example.hubsyncservice.security.HubAuthGuard;
import com.example.hubsyncservice.service.HubWriteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Hub-scoped writes. VIEW_ONLY members are rejected with 403.
 */
@RestController
@RequestMapping("/api/hubs/{hubId}/issues")
@RequiredArgsConstructor
@Slf4j
public class HubWriteController {

    private final HubAuthGuard hubAuthGuard;
    private final HubWriteService writeService;

    @PostMapping
    public ResponseEntity<HubIssueDto> createIssue(
            @PathVariable UUID hubId,
            @Valid @RequestBody CreateIssueRequest request) {
        HubAccess access = hubAuthGuard.authorizeWrite(hubId).orElseThrow();
        log.info("Creating issue in team {} for hub {} by {}", request.teamId(), hubId, access.identity().getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(writeService.createIssue(hubId, request));
    }

    @PostMapping("/{issueId}/comments")
    public ResponseEntity<HubCommentDto> createComment(
            @PathVariable UUID hubId,
            @PathVariable String issueId,
            @Valid @RequestBody CreateCommentRequest request) {
        hubAuthGuard.authorizeWrite(hubId).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(writeService.createComment(hubId, issueId, request.body()));
    }

    @PostMapping("/{issueId}/labels")
    public ResponseEntity<HubIssueDto> addLabel(
            @PathVariable UUID hubId,
            @PathVariable String issueId,
            @Valid @RequestBody LabelRequest request) {
        hubAuthGuard.authorizeWrite(hubId).orElseThrow();
        return ResponseEntity.ok(writeService.addLabel(hubId, issueId, request.labelId()));
    }

    @DeleteMapping("/{issueId}/labels/{labelId}")
    public ResponseEntity<HubIssueDto> removeLabel(
            @PathVariable UUID hubId,
            @PathVariable String issueId,
            @PathVariable String labelId) {
        hubAuthGuard.authorizeWrite(hubId).orElseThrow();
        return ResponseEntity.ok(writeService.removeLabel(hubId, issueId, labelId));
    }
}
