package com.example.hubsyncservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Caller is authenticated but its membership or role is insufficient (HTTP 403).
 */
public class AuthorizationDeniedException extends BaseException {

    public AuthorizationDeniedException(String code, String message) {
        super(code, message, HttpStatus.FORBIDDEN);
    }

    public AuthorizationDeniedException(String message) {
        super("FORBIDDEN", message, HttpStatus.FORBIDDEN);
    }

    public static AuthorizationDeniedException notAMember() {
        return new AuthorizationDeniedException("NOT_A_MEMBER", "Not a member of this hub");
    }

    public static AuthorizationDeniedException viewOnly() {
        return new AuthorizationDeniedException("VIEW_ONLY", "View-only users cannot perform this action");
    }

    public static AuthorizationDeniedException notAnAdmin() {
        return new AuthorizationDeniedException("NOT_AN_ADMIN", "Administrator access required");
    }
}
