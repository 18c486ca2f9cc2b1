package com.example.hubsyncservice.controller;

import com.example.hubsyncservice.dto.request.AddTeamMappingRequest;
import com.example.hubsyncservice.dto.request.CreateHubRequest;
import com.example.hubsyncservice.dto.request.InviteMemberRequest;
import com.example.hubsyncservice.dto.request.UpdateMemberRoleRequest;
import com.example.hubsyncservice.dto.request.UpdateTeamMappingRequest;
import com.example.hubsyncservice.dto.response.HubMemberResponse;
import com.example.hubsyncservice.dto.response.HubResponse;
import com.example.hubsyncservice.dto.response.TeamMappingResponse;
import com.example.hubsyncservice.security.AdminAuthGuard;
import com.example.hubsyncservice.security.AuthenticatedIdentity;
import com.example.hubsyncservice.service.HubMemberService;
import com.example.hubsyncservice.service.HubService;
import com.example.hubsyncservice.service.TeamMappingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Operator endpoints for hubs, their team mappings and their members.
 *
 * Authorization: global administrators only (401 when signed out, 403 otherwise).
 */
@RestController
@RequestMapping("/api/admin/hubs")
@RequiredArgsConstructor
@Slf4j
public class AdminHubController {

    private final AdminAuthGuard adminAuthGuard;
    private final HubService hubService;
    private final TeamMappingService teamMappingService;
    private final HubMemberService memberService;

    // ---- hubs ----

    @PostMapping
    public ResponseEntity<HubResponse> createHub(@Valid @RequestBody CreateHubRequest request) {
        AuthenticatedIdentity admin = adminAuthGuard.requireAdmin();
        log.info("Creating hub {} by {}", request.slug(), admin.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(hubService.createHub(request));
    }

    @GetMapping
    public ResponseEntity<List<HubResponse>> listHubs() {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(hubService.listHubs());
    }

    @GetMapping("/{hubId}")
    public ResponseEntity<HubResponse> getHub(@PathVariable UUID hubId) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(hubService.getHub(hubId));
    }

    @PostMapping("/{hubId}/deactivate")
    public ResponseEntity<HubResponse> deactivateHub(@PathVariable UUID hubId) {
        AuthenticatedIdentity admin = adminAuthGuard.requireAdmin();
        log.warn("Deactivating hub {} by {}", hubId, admin.getId());
        return ResponseEntity.ok(hubService.deactivate(hubId));
    }

    @PostMapping("/{hubId}/reactivate")
    public ResponseEntity<HubResponse> reactivateHub(@PathVariable UUID hubId) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(hubService.reactivate(hubId));
    }

    // ---- team mappings ----

    @GetMapping("/{hubId}/teams")
    public ResponseEntity<List<TeamMappingResponse>> listMappings(@PathVariable UUID hubId) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(teamMappingService.listMappings(hubId));
    }

    @PostMapping("/{hubId}/teams")
    public ResponseEntity<TeamMappingResponse> addMapping(
            @PathVariable UUID hubId,
            @Valid @RequestBody AddTeamMappingRequest request) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.status(HttpStatus.CREATED).body(teamMappingService.addMapping(hubId, request));
    }

    @PatchMapping("/{hubId}/teams/{mappingId}")
    public ResponseEntity<TeamMappingResponse> updateMapping(
            @PathVariable UUID hubId,
            @PathVariable UUID mappingId,
            @RequestBody UpdateTeamMappingRequest request) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(teamMappingService.updateMapping(hubId, mappingId, request));
    }

    @DeleteMapping("/{hubId}/teams/{mappingId}")
    public ResponseEntity<Void> deleteMapping(@PathVariable UUID hubId, @PathVariable UUID mappingId) {
        adminAuthGuard.requireAdmin();
        teamMappingService.deleteMapping(hubId, mappingId);
        return ResponseEntity.noContent().build();
    }

    // ---- members ----

    @GetMapping("/{hubId}/members")
    public ResponseEntity<List<HubMemberResponse>> listMembers(@PathVariable UUID hubId) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(memberService.listMembers(hubId));
    }

    @PostMapping("/{hubId}/members")
    public ResponseEntity<HubMemberResponse> inviteMember(
            @PathVariable UUID hubId,
            @Valid @RequestBody InviteMemberRequest request) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.status(HttpStatus.CREATED).body(memberService.invite(hubId, request));
    }

    @PatchMapping("/{hubId}/members/{memberId}")
    public ResponseEntity<HubMemberResponse> changeRole(
            @PathVariable UUID hubId,
            @PathVariable UUID memberId,
            @Valid @RequestBody UpdateMemberRoleRequest request) {
        adminAuthGuard.requireAdmin();
        return ResponseEntity.ok(memberService.changeRole(hubId, memberId, request.role()));
    }

    @DeleteMapping("/{hubId}/members/{memberId}")
    public ResponseEntity<Void> removeMember(@PathVariable UUID hubId, @PathVariable UUID memberId) {
        adminAuthGuard.requireAdmin();
        memberService.remove(hubId, memberId);
        return ResponseEntity.noContent().build();
    }
}
