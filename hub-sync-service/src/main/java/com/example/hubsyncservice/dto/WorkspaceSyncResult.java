package com.example.hubsyncservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregate result of a run over every active hub (initial sync, cron/scheduled reconcile).
 * No top-level success flag: {@code counts.errors} and {@code errorMessage} are the signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkspaceSyncResult {

    private String runType;
    private String correlationId;
    private int hubs;
    private int teams;
    private SyncCounts counts;
    private List<HubSyncResult> hubResults;
    private long durationMs;
    private String errorMessage;
}
