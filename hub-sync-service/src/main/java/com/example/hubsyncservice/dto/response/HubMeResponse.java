package com.example.hubsyncservice.dto.response;

import java.util.UUID;

public record HubMeResponse(UUID hubId, String identityId, String email, String role, boolean canWrite) {
}
