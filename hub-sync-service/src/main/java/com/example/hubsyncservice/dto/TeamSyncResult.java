package com.example.hubsyncservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of syncing one upstream team. {@code success} is false when the team step itself
 * failed; comment failures on single issues only raise {@code errors}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamSyncResult {

    private String teamId;
    private String teamName;
    private boolean success;
    private int projects;
    private int issues;
    private int comments;
    private int cycles;
    private int errors;
    private String errorMessage;
}
