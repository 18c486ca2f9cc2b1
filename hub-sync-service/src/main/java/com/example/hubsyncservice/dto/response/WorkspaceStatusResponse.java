package com.example.hubsyncservice.dto.response;

/**
 * Whether the workspace has an API token and an active webhook.
 */
public record WorkspaceStatusResponse(String workspaceId, boolean connected, boolean webhookActive,
                                      String webhookId, String webhookUrl) {
}
