package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.SyncedCycle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SyncedCycleRepository extends JpaRepository<SyncedCycle, Long> {

    /**
     * Same contract as the issue lookup: callers pass the hub's resolved team set.
     */
    List<SyncedCycle> findByWorkspaceIdAndTeamIdInOrderByStartsAtDesc(String workspaceId, Collection<String> teamIds);
}
