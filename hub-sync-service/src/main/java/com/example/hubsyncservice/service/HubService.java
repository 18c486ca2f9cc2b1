package com.example.hubsyncservice.service;

import com.example.hubsyncservice.cache.TeamHubMappingCache;
import com.example.hubsyncservice.dto.request.CreateHubRequest;
import com.example.hubsyncservice.dto.response.HubResponse;
import com.example.hubsyncservice.entity.Hub;
import com.example.hubsyncservice.exception.ConflictException;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.repository.HubRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Hub lifecycle for operators. Hubs are deactivated, never deleted; toggling the flag changes
 * which mappings are effective, so both directions invalidate the mapping cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HubService {

    private final HubRepository hubRepository;
    private final TeamHubMappingCache mappingCache;

    @Transactional
    public HubResponse createHub(CreateHubRequest request) {
        if (hubRepository.existsBySlug(request.slug())) {
            throw ConflictException.slugTaken(request.slug());
        }
        Hub hub = hubRepository.save(Hub.builder()
                .name(request.name().trim())
                .slug(request.slug())
                .externalOrgId(request.externalOrgId())
                .build());
        log.info("✅ Hub created: id={}, slug={}", hub.getId(), hub.getSlug());
        return HubResponse.from(hub);
    }

    @Transactional(readOnly = true)
    public List<HubResponse> listHubs() {
        return hubRepository.findAllByOrderByNameAsc().stream()
                .map(HubResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public HubResponse getHub(UUID hubId) {
        return HubResponse.from(load(hubId));
    }

    @Transactional
    public HubResponse deactivate(UUID hubId) {
        return setActive(hubId, false);
    }

    @Transactional
    public HubResponse reactivate(UUID hubId) {
        return setActive(hubId, true);
    }

    private HubResponse setActive(UUID hubId, boolean active) {
        Hub hub = load(hubId);
        if (hub.isActive() == active) {
            return HubResponse.from(hub);
        }
        hub.setActive(active);
        Hub saved = hubRepository.save(hub);
        mappingCache.invalidate();
        log.warn("Hub {} {}", hubId, active ? "reactivated" : "deactivated");
        return HubResponse.from(saved);
    }

    private Hub load(UUID hubId) {
        return hubRepository.findById(hubId).orElseThrow(() -> ResourceNotFoundException.hub(hubId));
    }
}
