package com.example.hubsyncservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed or incomplete request (HTTP 400).
 */
public class ValidationException extends BaseException {

    public ValidationException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message, HttpStatus.BAD_REQUEST);
    }

    public static ValidationException hubInactive() {
        return new ValidationException("HUB_INACTIVE", "Hub is inactive");
    }

    public static ValidationException noTeamsConfigured() {
        return new ValidationException("NO_TEAMS", "No teams configured for this hub");
    }

    public static ValidationException noFieldsToUpdate() {
        return new ValidationException("NO_FIELDS", "No fields to update");
    }

    public static ValidationException invalidJson() {
        return new ValidationException("INVALID_JSON", "Invalid JSON");
    }

    public static ValidationException labelNotAllowed(String labelId) {
        return new ValidationException("LABEL_NOT_ALLOWED", "Label is not available in this hub: " + labelId);
    }

    public static ValidationException projectRequired() {
        return new ValidationException("PROJECT_REQUIRED", "A project is required for issues in this team");
    }
}
