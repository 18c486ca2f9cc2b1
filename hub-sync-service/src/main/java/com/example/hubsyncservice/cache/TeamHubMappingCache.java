package com.example.hubsyncservice.cache;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Upstream team → hub lookup used both to filter webhook ingestion and to scope hub reads.
 *
 * Only mappings that are active and belong to an active hub are visible here. Every code path
 * that creates, updates or deletes a team mapping (or (de)activates a hub) must call
 * {@link #invalidate()} before its request completes; a missed call leaks or hides data for up
 * to one TTL.
 *
 * The in-process implementation is only coherent within a single JVM.
 */
public interface TeamHubMappingCache {

    boolean isTeamTracked(String teamId);

    List<UUID> hubsForTeam(String teamId);

    /**
     * Effective mappings of the hub; empty for unknown or inactive hubs.
     */
    List<TeamMappingView> mappingsForHub(UUID hubId);

    Set<String> trackedTeamIds();

    void invalidate();
}
