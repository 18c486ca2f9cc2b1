package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.SyncedInitiative;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SyncedInitiativeRepository extends JpaRepository<SyncedInitiative, Long> {

    List<SyncedInitiative> findByWorkspaceIdOrderByNameAsc(String workspaceId);

    List<SyncedInitiative> findByWorkspaceIdAndLinearIdInOrderByNameAsc(String workspaceId, Collection<String> linearIds);
}
