package com.example.hubsyncservice.dto.response;

import java.time.Instant;

public record HubCommentDto(String id, String body, String authorName, Instant createdAt, Instant updatedAt) {
}
