package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.SyncedIssue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SyncedIssueRepository extends JpaRepository<SyncedIssue, Long> {

    /**
     * Tenant reads always pass the hub's resolved team set here; never an unchecked caller id.
     */
    List<SyncedIssue> findByWorkspaceIdAndTeamIdInOrderByUpdatedAtDesc(String workspaceId, Collection<String> teamIds);

    Optional<SyncedIssue> findByWorkspaceIdAndLinearId(String workspaceId, String linearId);
}
