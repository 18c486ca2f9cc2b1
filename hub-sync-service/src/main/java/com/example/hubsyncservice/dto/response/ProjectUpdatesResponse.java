package com.example.hubsyncservice.dto.response;

import java.time.Instant;
import java.util.List;

/**
 * Status posts of a project, newest first.
 */
public record ProjectUpdatesResponse(String projectId, String projectName, List<Update> updates) {

    public record Update(String id, String body, String health, Instant createdAt, Instant updatedAt) {
    }
}
