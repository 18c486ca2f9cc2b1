package com.example.hubsyncservice.dto.response;

import com.example.hubsyncservice.entity.Hub;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HubResponse {

    private UUID id;
    private String name;
    private String slug;
    private boolean active;
    private String externalOrgId;
    private Instant createdAt;
    private Instant updatedAt;

    public static HubResponse from(Hub hub) {
        return HubResponse.builder()
                .id(hub.getId())
                .name(hub.getName())
                .slug(hub.getSlug())
                .active(hub.isActive())
                .externalOrgId(hub.getExternalOrgId())
                .createdAt(hub.getCreatedAt())
                .updatedAt(hub.getUpdatedAt())
                .build();
    }
}
