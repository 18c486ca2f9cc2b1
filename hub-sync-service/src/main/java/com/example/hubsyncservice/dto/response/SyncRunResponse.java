package com.example.hubsyncservice.dto.response;

import com.example.hubsyncservice.entity.SyncRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunResponse {

    private Long id;
    private UUID hubId;
    private SyncRun.RunType runType;
    private SyncRun.RunTrigger trigger;
    private SyncRun.RunStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Integer teamsSynced;
    private Integer projectsSynced;
    private Integer issuesSynced;
    private Integer commentsSynced;
    private Integer cyclesSynced;
    private Integer initiativesSynced;
    private Integer errorCount;
    private String errorMessage;
    private String correlationId;

    public static SyncRunResponse from(SyncRun run) {
        return SyncRunResponse.builder()
                .id(run.getId())
                .hubId(run.getHubId())
                .runType(run.getRunType())
                .trigger(run.getTrigger())
                .status(run.getStatus())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .durationMs(run.getDurationMs())
                .teamsSynced(run.getTeamsSynced())
                .projectsSynced(run.getProjectsSynced())
                .issuesSynced(run.getIssuesSynced())
                .commentsSynced(run.getCommentsSynced())
                .cyclesSynced(run.getCyclesSynced())
                .initiativesSynced(run.getInitiativesSynced())
                .errorCount(run.getErrorCount())
                .errorMessage(run.getErrorMessage())
                .correlationId(run.getCorrelationId())
                .build();
    }
}
