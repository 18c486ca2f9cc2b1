package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.SyncedTeam;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SyncedTeamRepository extends JpaRepository<SyncedTeam, Long> {

    List<SyncedTeam> findByWorkspaceIdAndLinearIdInOrderByNameAsc(String workspaceId, Collection<String> linearIds);
}
