package com.example.hubsyncservice.service;

import com.example.hubsyncservice.entity.Hub;
import com.example.hubsyncservice.entity.HubTeamMapping;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.exception.ValidationException;
import com.example.hubsyncservice.repository.HubRepository;
import com.example.hubsyncservice.repository.HubTeamMappingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Which upstream teams a sync or reconcile run covers. Read straight from the mapping table so
 * a run never starts from a stale cache snapshot.
 */
@Component
@RequiredArgsConstructor
public class SyncTargetResolver {

    private final HubRepository hubRepository;
    private final HubTeamMappingRepository mappingRepository;

    public record TeamTarget(UUID hubId, String teamId, String teamName) {
    }

    /**
     * @throws ResourceNotFoundException hub does not exist
     * @throws ValidationException       hub is inactive or has no active team mapping
     */
    @Transactional(readOnly = true)
    public List<TeamTarget> teamsOfHub(UUID hubId) {
        Hub hub = hubRepository.findById(hubId)
                .orElseThrow(() -> ResourceNotFoundException.hub(hubId));
        if (!hub.isActive()) {
            throw ValidationException.hubInactive();
        }

        List<TeamTarget> targets = mappingRepository.findByHubIdAndActiveTrue(hubId).stream()
                .map(SyncTargetResolver::toTarget)
                .toList();
        if (targets.isEmpty()) {
            throw ValidationException.noTeamsConfigured();
        }
        return targets;
    }

    /**
     * Active mappings of active hubs, grouped by hub.
     */
    @Transactional(readOnly = true)
    public Map<UUID, List<TeamTarget>> teamsByActiveHub() {
        Map<UUID, List<TeamTarget>> byHub = new LinkedHashMap<>();
        for (HubTeamMapping mapping : mappingRepository.findAllEffective()) {
            byHub.computeIfAbsent(mapping.getHubId(), k -> new ArrayList<>()).add(toTarget(mapping));
        }
        return byHub;
    }

    private static TeamTarget toTarget(HubTeamMapping mapping) {
        return new TeamTarget(mapping.getHubId(), mapping.getLinearTeamId(), mapping.getLinearTeamName());
    }
}
