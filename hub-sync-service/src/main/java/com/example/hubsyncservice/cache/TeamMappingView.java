package com.example.hubsyncservice.cache;

import com.example.hubsyncservice.entity.HubTeamMapping;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Immutable copy of an effective team mapping as held by the cache.
 */
@Value
@Builder
public class TeamMappingView {

    UUID mappingId;
    UUID hubId;
    String teamId;
    String teamName;
    List<String> visibleProjectIds;
    List<String> visibleInitiativeIds;
    List<String> visibleLabelIds;
    List<String> hiddenLabelIds;

    public static TeamMappingView from(HubTeamMapping mapping) {
        return TeamMappingView.builder()
                .mappingId(mapping.getId())
                .hubId(mapping.getHubId())
                .teamId(mapping.getLinearTeamId())
                .teamName(mapping.getLinearTeamName())
                .visibleProjectIds(copy(mapping.getVisibleProjectIds()))
                .visibleInitiativeIds(copy(mapping.getVisibleInitiativeIds()))
                .visibleLabelIds(copy(mapping.getVisibleLabelIds()))
                .hiddenLabelIds(copy(mapping.getHiddenLabelIds()))
                .build();
    }

    /** Empty allow-list means unrestricted. */
    public boolean isProjectVisible(String projectId) {
        return visibleProjectIds.isEmpty() || (projectId != null && visibleProjectIds.contains(projectId));
    }

    public boolean isLabelVisible(String labelId) {
        return (visibleLabelIds.isEmpty() || visibleLabelIds.contains(labelId)) && !hiddenLabelIds.contains(labelId);
    }

    public boolean hidesAnyOf(List<String> labelIds) {
        return labelIds.stream().anyMatch(hiddenLabelIds::contains);
    }

    private static List<String> copy(List<String> ids) {
        return ids == null ? List.of() : List.copyOf(ids);
    }
}
