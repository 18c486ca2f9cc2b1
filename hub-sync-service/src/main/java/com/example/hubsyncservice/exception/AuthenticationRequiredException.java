package com.example.hubsyncservice.exception;

import org.springframework.http.HttpStatus;

/**
 * No authenticated identity on the request (HTTP 401).
 */
public class AuthenticationRequiredException extends BaseException {

    public AuthenticationRequiredException(String message) {
        super("UNAUTHENTICATED", message, HttpStatus.UNAUTHORIZED);
    }

    public static AuthenticationRequiredException notSignedIn() {
        return new AuthenticationRequiredException("Authentication required");
    }

    public static AuthenticationRequiredException invalidCronSecret() {
        return new AuthenticationRequiredException("Invalid cron secret");
    }
}
