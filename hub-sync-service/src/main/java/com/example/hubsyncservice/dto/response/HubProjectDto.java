package com.example.hubsyncservice.dto.response;

import java.time.Instant;
import java.util.List;

public record HubProjectDto(
        String id,
        String name,
        String description,
        String state,
        List<String> teamIds,
        Instant createdAt,
        Instant updatedAt
) {
}
