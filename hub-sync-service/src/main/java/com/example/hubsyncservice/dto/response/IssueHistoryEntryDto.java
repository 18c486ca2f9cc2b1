package com.example.hubsyncservice.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * One state, priority or label change of an issue. Assignee changes are never listed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IssueHistoryEntryDto(
        String id,
        Instant createdAt,
        ChangeType type,
        StateDto fromState,
        StateDto toState,
        Integer fromPriority,
        Integer toPriority,
        List<LabelDto> addedLabels,
        List<LabelDto> removedLabels
) {

    public enum ChangeType {
        STATE, PRIORITY, LABEL
    }
}
