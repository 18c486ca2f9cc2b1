package com.example.hubsyncservice.dto.request;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Map an upstream team into a hub. Omitted allow-lists are stored empty (unscoped).
 */
public record AddTeamMappingRequest(

    @NotBlank(message = "Team ID is required")
    String teamId,

    String teamName,

    List<String> visibleProjectIds,

    List<String> visibleInitiativeIds,

    List<String> visibleLabelIds,

    List<String> hiddenLabelIds
) {}
