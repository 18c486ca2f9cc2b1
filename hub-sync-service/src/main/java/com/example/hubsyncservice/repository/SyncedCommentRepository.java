package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.SyncedComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SyncedCommentRepository extends JpaRepository<SyncedComment, Long> {

    List<SyncedComment> findByWorkspaceIdAndIssueLinearIdOrderByCreatedAtAsc(String workspaceId, String issueLinearId);
}
