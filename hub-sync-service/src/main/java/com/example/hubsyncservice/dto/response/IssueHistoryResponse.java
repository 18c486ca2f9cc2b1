package com.example.hubsyncservice.dto.response;

import java.util.List;
import java.util.Map;

public record IssueHistoryResponse(List<IssueHistoryEntryDto> history, Map<Integer, String> priorityLabels) {

    public static final Map<Integer, String> PRIORITY_LABELS = Map.of(
            0, "No priority",
            1, "Urgent",
            2, "High",
            3, "Medium",
            4, "Low");

    public static IssueHistoryResponse of(List<IssueHistoryEntryDto> history) {
        return new IssueHistoryResponse(history, PRIORITY_LABELS);
    }
}
