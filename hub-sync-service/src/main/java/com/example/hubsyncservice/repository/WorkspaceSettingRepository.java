package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.WorkspaceSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WorkspaceSettingRepository extends JpaRepository<WorkspaceSetting, Long> {

    Optional<WorkspaceSetting> findByWorkspaceIdAndKey(String workspaceId, String key);
}
