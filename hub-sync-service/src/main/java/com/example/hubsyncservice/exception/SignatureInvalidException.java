package com.example.hubsyncservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Webhook delivery without a valid signature (HTTP 401).
 */
public class SignatureInvalidException extends BaseException {

    public SignatureInvalidException(String message) {
        super("INVALID_SIGNATURE", message, HttpStatus.UNAUTHORIZED);
    }

    public static SignatureInvalidException missing() {
        return new SignatureInvalidException("Missing signature");
    }

    public static SignatureInvalidException mismatch() {
        return new SignatureInvalidException("Invalid signature");
    }
}
