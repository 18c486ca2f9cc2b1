package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.SyncRun;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {

    /**
     * Runs with the given status that covered the hub, newest first: the hub's own runs and
     * workspace-wide runs (hub_id NULL).
     */
    @Query("""
            SELECT r FROM SyncRun r
            WHERE r.status = :status
              AND (r.hubId = :hubId OR r.hubId IS NULL)
            ORDER BY r.startedAt DESC
            """)
    List<SyncRun> findCoveringHubByStatus(@Param("hubId") UUID hubId,
                                          @Param("status") SyncRun.RunStatus status,
                                          Pageable pageable);

    default Optional<SyncRun> findLastCompletedCoveringHub(UUID hubId) {
        return findCoveringHubByStatus(hubId, SyncRun.RunStatus.COMPLETED, PageRequest.of(0, 1))
                .stream()
                .findFirst();
    }

    List<SyncRun> findByHubIdOrderByStartedAtDesc(UUID hubId, Pageable pageable);

    List<SyncRun> findAllByOrderByStartedAtDesc(Pageable pageable);
}
