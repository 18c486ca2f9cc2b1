package com.example.hubsyncservice.service;

import com.example.hubsyncservice.cache.TeamHubMappingCache;
import com.example.hubsyncservice.dto.request.AddTeamMappingRequest;
import com.example.hubsyncservice.dto.request.UpdateTeamMappingRequest;
import com.example.hubsyncservice.dto.response.TeamMappingResponse;
import com.example.hubsyncservice.entity.HubTeamMapping;
import com.example.hubsyncservice.exception.ConflictException;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.exception.ValidationException;
import com.example.hubsyncservice.repository.HubRepository;
import com.example.hubsyncservice.repository.HubTeamMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Team mappings of a hub.
 *
 * A team is actively mapped to at most one hub: add and reactivation check every other hub
 * first (409), and the partial unique index on active mappings backs the check up. Every
 * mutation invalidates the mapping cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeamMappingService {

    private final HubRepository hubRepository;
    private final HubTeamMappingRepository mappingRepository;
    private final TeamHubMappingCache mappingCache;

    @Transactional(readOnly = true)
    public List<TeamMappingResponse> listMappings(UUID hubId) {
        requireHub(hubId);
        return mappingRepository.findByHubIdOrderByCreatedAtAsc(hubId).stream()
                .map(TeamMappingResponse::from)
                .toList();
    }

    @Transactional
    public TeamMappingResponse addMapping(UUID hubId, AddTeamMappingRequest request) {
        requireHub(hubId);
        String teamId = request.teamId() == null ? null : request.teamId().trim();
        if (teamId == null || teamId.isEmpty()) {
            throw new ValidationException("TEAM_ID_REQUIRED", "teamId is required");
        }
        requireNotMappedElsewhere(teamId, hubId);

        HubTeamMapping mapping = mappingRepository.findByHubIdAndLinearTeamId(hubId, teamId)
                .orElseGet(() -> HubTeamMapping.builder().hubId(hubId).linearTeamId(teamId).build());
        mapping.setLinearTeamName(request.teamName());
        mapping.setVisibleProjectIds(clean(request.visibleProjectIds()));
        mapping.setVisibleInitiativeIds(clean(request.visibleInitiativeIds()));
        mapping.setVisibleLabelIds(clean(request.visibleLabelIds()));
        mapping.setHiddenLabelIds(clean(request.hiddenLabelIds()));
        mapping.setActive(true);

        HubTeamMapping saved = mappingRepository.save(mapping);
        mappingCache.invalidate();
        log.info("✅ Team {} mapped to hub {} (mappingId={})", teamId, hubId, saved.getId());
        return TeamMappingResponse.from(saved);
    }

    @Transactional
    public TeamMappingResponse updateMapping(UUID hubId, UUID mappingId, UpdateTeamMappingRequest request) {
        if (request == null || !request.hasAnyField()) {
            throw ValidationException.noFieldsToUpdate();
        }
        HubTeamMapping mapping = mappingRepository.findByIdAndHubId(mappingId, hubId)
                .orElseThrow(() -> ResourceNotFoundException.mapping(mappingId));

        if (Boolean.TRUE.equals(request.active()) && !mapping.isActive()) {
            requireNotMappedElsewhere(mapping.getLinearTeamId(), hubId);
        }

        if (request.teamName() != null) {
            mapping.setLinearTeamName(request.teamName());
        }
        if (request.visibleProjectIds() != null) {
            mapping.setVisibleProjectIds(clean(request.visibleProjectIds()));
        }
        if (request.visibleInitiativeIds() != null) {
            mapping.setVisibleInitiativeIds(clean(request.visibleInitiativeIds()));
        }
        if (request.visibleLabelIds() != null) {
            mapping.setVisibleLabelIds(clean(request.visibleLabelIds()));
        }
        if (request.hiddenLabelIds() != null) {
            mapping.setHiddenLabelIds(clean(request.hiddenLabelIds()));
        }
        if (request.active() != null) {
            mapping.setActive(request.active());
        }

        HubTeamMapping saved = mappingRepository.save(mapping);
        mappingCache.invalidate();
        log.info("Team mapping {} of hub {} updated", mappingId, hubId);
        return TeamMappingResponse.from(saved);
    }

    @Transactional
    public void deleteMapping(UUID hubId, UUID mappingId) {
        HubTeamMapping mapping = mappingRepository.findByIdAndHubId(mappingId, hubId)
                .orElseThrow(() -> ResourceNotFoundException.mapping(mappingId));
        mappingRepository.delete(mapping);
        mappingCache.invalidate();
        log.warn("Team mapping {} (team {}) removed from hub {}", mappingId, mapping.getLinearTeamId(), hubId);
    }

    private void requireHub(UUID hubId) {
        if (!hubRepository.existsById(hubId)) {
            throw ResourceNotFoundException.hub(hubId);
        }
    }

    private void requireNotMappedElsewhere(String teamId, UUID hubId) {
        mappingRepository.findFirstByLinearTeamIdAndActiveTrueAndHubIdNot(teamId, hubId)
                .ifPresent(other -> {
                    throw ConflictException.teamAlreadyMapped(other.getHubId());
                });
    }

    private static List<String> clean(List<String> ids) {
        if (ids == null) {
            return new ArrayList<>();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                unique.add(id.trim());
            }
        }
        return new ArrayList<>(unique);
    }
}
