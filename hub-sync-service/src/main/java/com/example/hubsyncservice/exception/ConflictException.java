package com.example.hubsyncservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Request conflicts with existing state (HTTP 409).
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    /**
     * The team is already actively mapped to another hub.
     */
    public static ConflictException teamAlreadyMapped(Object otherHubId) {
        return new ConflictException("TEAM_ALREADY_MAPPED", "Team is already mapped to hub " + otherHubId);
    }

    public static ConflictException memberExists(String email) {
        return new ConflictException("MEMBER_EXISTS", "Member already exists: " + email);
    }

    public static ConflictException slugTaken(String slug) {
        return new ConflictException("SLUG_TAKEN", "Hub slug already in use: " + slug);
    }

    public static ConflictException webhookExists(String webhookId) {
        return new ConflictException("WEBHOOK_EXISTS", "Webhook already connected: " + webhookId);
    }
}
