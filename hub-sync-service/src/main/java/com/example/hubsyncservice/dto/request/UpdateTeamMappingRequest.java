package com.example.hubsyncservice.dto.request;

import java.util.List;

/**
 * Partial update of a team mapping. Null fields are left untouched; an empty list clears the
 * allow-list (making that kind unscoped).
 */
public record UpdateTeamMappingRequest(
    String teamName,
    List<String> visibleProjectIds,
    List<String> visibleInitiativeIds,
    List<String> visibleLabelIds,
    List<String> hiddenLabelIds,
    Boolean active
) {

    public boolean hasAnyField() {
        return teamName != null
                || visibleProjectIds != null
                || visibleInitiativeIds != null
                || visibleLabelIds != null
                || hiddenLabelIds != null
                || active != null;
    }
}
