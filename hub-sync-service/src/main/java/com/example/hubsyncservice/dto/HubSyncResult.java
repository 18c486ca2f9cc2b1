package com.example.hubsyncservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Result of a single-hub sync or reconcile.
 *
 * {@code success} is advisory: it is false only when the run could not start its team work
 * (for example no workspace token). Per-team failures leave it true and show up in
 * {@code counts.errors} and in the team results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HubSyncResult {

    private UUID hubId;
    private String runType;
    private Long syncRunId;
    private String correlationId;
    private boolean success;
    private Instant watermark;
    private SyncCounts counts;
    private List<TeamSyncResult> teams;
    private long durationMs;
    private String errorMessage;
}
