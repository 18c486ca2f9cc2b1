package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.SyncedProject;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SyncedProjectRepository extends JpaRepository<SyncedProject, Long> {

    List<SyncedProject> findByWorkspaceIdOrderByNameAsc(String workspaceId);

    List<SyncedProject> findByWorkspaceIdAndLinearIdInOrderByNameAsc(String workspaceId, Collection<String> linearIds);
}
