package com.example.hubsyncservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Hub, mapping or mirror entity is missing, deactivated or outside the caller's hub (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException hub(Object hubId) {
        return new ResourceNotFoundException("HUB_NOT_FOUND", "Hub not found: " + hubId);
    }

    public static ResourceNotFoundException mapping(Object mappingId) {
        return new ResourceNotFoundException("MAPPING_NOT_FOUND", "Team mapping not found: " + mappingId);
    }

    public static ResourceNotFoundException member(Object memberId) {
        return new ResourceNotFoundException("MEMBER_NOT_FOUND", "Member not found: " + memberId);
    }

    public static ResourceNotFoundException issue(String issueId) {
        return new ResourceNotFoundException("ISSUE_NOT_FOUND", "Issue not found: " + issueId);
    }

    public static ResourceNotFoundException team(String teamId) {
        return new ResourceNotFoundException("TEAM_NOT_FOUND", "Team not found in this hub: " + teamId);
    }

    public static ResourceNotFoundException webhook(Object id) {
        return new ResourceNotFoundException("WEBHOOK_NOT_FOUND", "Webhook subscription not found: " + id);
    }

    public static ResourceNotFoundException project(String projectId) {
        return new ResourceNotFoundException("PROJECT_NOT_FOUND", "Project not found in this hub: " + projectId);
    }
}
