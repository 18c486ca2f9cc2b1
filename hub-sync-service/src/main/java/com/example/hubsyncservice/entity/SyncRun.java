package com.example.hubsyncservice.entity;

import com.example.hubsyncservice.dto.SyncCounts;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution of a full sync or reconciliation.
 * {@code hubId} is null for workspace-wide runs. The start time of the last COMPLETED run is
 * the reconciler's watermark anchor.
 */
@Entity
@Table(name = "sync_runs", indexes = {
        @Index(name = "idx_sync_runs_hub_status", columnList = "hub_id,status"),
        @Index(name = "idx_sync_runs_started_at", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncRun extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hub_id")
    private UUID hubId;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_type", nullable = false, length = 20)
    private RunType runType;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_trigger", nullable = false, length = 20)
    private RunTrigger trigger;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "teams_synced")
    private Integer teamsSynced;

    @Column(name = "projects_synced")
    private Integer projectsSynced;

    @Column(name = "issues_synced")
    private Integer issuesSynced;

    @Column(name = "comments_synced")
    private Integer commentsSynced;

    @Column(name = "cycles_synced")
    private Integer cyclesSynced;

    @Column(name = "initiatives_synced")
    private Integer initiativesSynced;

    @Column(name = "error_count")
    private Integer errorCount;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    public Long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }

    public void markAsStarted(String correlationId, Instant now) {
        this.status = RunStatus.RUNNING;
        this.startedAt = now;
        this.correlationId = correlationId;
    }

    /**
     * Close the run with its counters. Any error moves the run to PARTIAL_FAILURE, which does
     * not advance the reconcile watermark.
     */
    public void markAsFinished(SyncCounts counts, Instant now) {
        this.status = counts.getErrors() > 0 ? RunStatus.PARTIAL_FAILURE : RunStatus.COMPLETED;
        this.completedAt = now;
        this.teamsSynced = counts.getTeams();
        this.projectsSynced = counts.getProjects();
        this.issuesSynced = counts.getIssues();
        this.commentsSynced = counts.getComments();
        this.cyclesSynced = counts.getCycles();
        this.initiativesSynced = counts.getInitiatives();
        this.errorCount = counts.getErrors();
    }

    public void markAsFailed(String errorMessage, Instant now) {
        this.status = RunStatus.FAILED;
        this.completedAt = now;
        this.errorMessage = errorMessage;
    }

    public enum RunType {
        FULL_SYNC,
        RECONCILE
    }

    public enum RunTrigger {
        MANUAL,
        CRON,
        SCHEDULER
    }

    public enum RunStatus {
        RUNNING,
        COMPLETED,
        PARTIAL_FAILURE,
        FAILED
    }
}
