package com.example.hubsyncservice.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Issue submitted from a hub. Labels outside the team's visibility rules are dropped silently.
 */
public record CreateIssueRequest(

    @NotBlank(message = "Team ID is required")
    String teamId,

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    String title,

    @Size(max = 50000, message = "Description is too long")
    String description,

    String projectId,

    List<String> labelIds,

    @Min(value = 0, message = "Priority must be between 0 and 4")
    @Max(value = 4, message = "Priority must be between 0 and 4")
    Integer priority
) {}
