package com.example.hubsyncservice.dto.response;

import com.example.hubsyncservice.entity.HubTeamMapping;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamMappingResponse {

    private UUID id;
    private UUID hubId;
    private String teamId;
    private String teamName;
    private List<String> visibleProjectIds;
    private List<String> visibleInitiativeIds;
    private List<String> visibleLabelIds;
    private List<String> hiddenLabelIds;
    private boolean active;
    private Instant createdAt;

    public static TeamMappingResponse from(HubTeamMapping mapping) {
        return TeamMappingResponse.builder()
                .id(mapping.getId())
                .hubId(mapping.getHubId())
                .teamId(mapping.getLinearTeamId())
                .teamName(mapping.getLinearTeamName())
                .visibleProjectIds(List.copyOf(mapping.getVisibleProjectIds()))
                .visibleInitiativeIds(List.copyOf(mapping.getVisibleInitiativeIds()))
                .visibleLabelIds(List.copyOf(mapping.getVisibleLabelIds()))
                .hiddenLabelIds(List.copyOf(mapping.getHiddenLabelIds()))
                .active(mapping.isActive())
                .createdAt(mapping.getCreatedAt())
                .build();
    }
}
