package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.HubTeamMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HubTeamMappingRepository extends JpaRepository<HubTeamMapping, UUID> {

    /**
     * Every mapping that currently grants visibility: the mapping and its hub are both active.
     * This is the source of the team mapping cache.
     */
    @Query("""
            SELECT m FROM HubTeamMapping m
            WHERE m.active = true
              AND m.hubId IN (SELECT h.id FROM Hub h WHERE h.active = true)
            """)
    List<HubTeamMapping> findAllEffective();

    List<HubTeamMapping> findByHubIdOrderByCreatedAtAsc(UUID hubId);

    List<HubTeamMapping> findByHubIdAndActiveTrue(UUID hubId);

    Optional<HubTeamMapping> findByIdAndHubId(UUID id, UUID hubId);

    Optional<HubTeamMapping> findFirstByLinearTeamIdAndActiveTrueAndHubIdNot(String linearTeamId, UUID hubId);

    Optional<HubTeamMapping> findByHubIdAndLinearTeamId(UUID hubId, String linearTeamId);
}
