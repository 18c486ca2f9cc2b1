package com.example.hubsyncservice.dto.response;

import java.time.Instant;
import java.util.List;

/**
 * Issue as shown to hub members. There is no assignee field; no visibility
 * setting can expose who an issue is assigned to.
 */
public record HubIssueDto(
        String id,
        String identifier,
        String title,
        String description,
        StateDto state,
        Integer priority,
        String url,
        String dueDate,
        String teamId,
        String projectId,
        List<LabelDto> labels,
        Instant createdAt,
        Instant updatedAt
) {
}
