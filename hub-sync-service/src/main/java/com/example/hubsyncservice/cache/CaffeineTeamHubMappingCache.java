package com.example.hubsyncservice.cache;

import com.example.hubsyncservice.entity.HubTeamMapping;
import com.example.hubsyncservice.metrics.SyncMetrics;
import com.example.hubsyncservice.repository.HubTeamMappingRepository;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Process-memory {@link TeamHubMappingCache}: one snapshot of all effective mappings, reloaded
 * from the database once it is older than the TTL (default 60s).
 *
 * If a TTL-driven reload fails, the previous snapshot keeps being served. After an explicit
 * {@link #invalidate()} there is no previous snapshot, so a failed reload propagates.
 */
@Component
@Slf4j
public class CaffeineTeamHubMappingCache implements TeamHubMappingCache {

    private static final String SNAPSHOT_KEY = "effective-team-mappings";

    private final HubTeamMappingRepository mappingRepository;
    private final SyncMetrics syncMetrics;
    private final LoadingCache<String, Snapshot> cache;
    private volatile Snapshot lastKnown;

    @Autowired
    public CaffeineTeamHubMappingCache(HubTeamMappingRepository mappingRepository,
                                       SyncMetrics syncMetrics,
                                       @Value("${hub.mapping-cache.ttl-seconds:60}") long ttlSeconds) {
        this(mappingRepository, syncMetrics, Duration.ofSeconds(ttlSeconds), Ticker.systemTicker());
    }

    CaffeineTeamHubMappingCache(HubTeamMappingRepository mappingRepository,
                                SyncMetrics syncMetrics,
                                Duration ttl,
                                Ticker ticker) {
        this.mappingRepository = mappingRepository;
        this.syncMetrics = syncMetrics;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build(key -> load());
    }

    @Override
    public boolean isTeamTracked(String teamId) {
        return teamId != null && snapshot().byTeam.containsKey(teamId);
    }

    @Override
    public List<UUID> hubsForTeam(String teamId) {
        if (teamId == null) {
            return List.of();
        }
        return snapshot().byTeam.getOrDefault(teamId, List.of()).stream()
                .map(TeamMappingView::getHubId)
                .distinct()
                .toList();
    }

    @Override
    public List<TeamMappingView> mappingsForHub(UUID hubId) {
        return snapshot().byHub.getOrDefault(hubId, List.of());
    }

    @Override
    public Set<String> trackedTeamIds() {
        return snapshot().byTeam.keySet();
    }

    /**
     * Drops the snapshot now and again once the surrounding transaction completes, so a reload
     * racing the transaction cannot keep pre-commit state alive.
     */
    @Override
    public void invalidate() {
        evict();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    evict();
                }
            });
        }
        log.debug("Team mapping cache invalidated");
    }

    private void evict() {
        lastKnown = null;
        cache.invalidate(SNAPSHOT_KEY);
    }

    private Snapshot snapshot() {
        try {
            return cache.get(SNAPSHOT_KEY);
        } catch (RuntimeException e) {
            Snapshot stale = lastKnown;
            if (stale == null) {
                throw e;
            }
            log.warn("⚠️ Team mapping reload failed, serving previous snapshot: {}", e.getMessage());
            return stale;
        }
    }

    private Snapshot load() {
        List<HubTeamMapping> mappings;
        try {
            mappings = mappingRepository.findAllEffective();
        } catch (RuntimeException e) {
            syncMetrics.recordCacheReload(false);
            throw e;
        }

        Map<String, List<TeamMappingView>> byTeam = new HashMap<>();
        Map<UUID, List<TeamMappingView>> byHub = new HashMap<>();
        for (HubTeamMapping mapping : mappings) {
            TeamMappingView view = TeamMappingView.from(mapping);
            byTeam.computeIfAbsent(view.getTeamId(), k -> new ArrayList<>()).add(view);
            byHub.computeIfAbsent(view.getHubId(), k -> new ArrayList<>()).add(view);
        }
        Snapshot snapshot = new Snapshot(freeze(byTeam), freeze(byHub));
        lastKnown = snapshot;
        syncMetrics.recordCacheReload(true);
        log.debug("Loaded {} effective team mappings for {} hub(s)", mappings.size(), byHub.size());
        return snapshot;
    }

    private static <K> Map<K, List<TeamMappingView>> freeze(Map<K, List<TeamMappingView>> map) {
        Map<K, List<TeamMappingView>> copy = new HashMap<>();
        map.forEach((key, views) -> copy.put(key, List.copyOf(views)));
        return Collections.unmodifiableMap(copy);
    }

    private record Snapshot(Map<String, List<TeamMappingView>> byTeam, Map<UUID, List<TeamMappingView>> byHub) {
    }
}
