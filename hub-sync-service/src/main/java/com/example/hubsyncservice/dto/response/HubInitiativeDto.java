package com.example.hubsyncservice.dto.response;

import java.time.Instant;

public record HubInitiativeDto(String id, String name, String description, String status, Instant updatedAt) {
}
