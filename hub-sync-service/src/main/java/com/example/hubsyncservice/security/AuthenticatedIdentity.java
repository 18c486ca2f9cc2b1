package com.example.hubsyncservice.security;

import lombok.Getter;

/**
 * Caller resolved from the bearer token. Stored as the principal of the security context.
 */
@Getter
public class AuthenticatedIdentity {

    private final String id;
    private final String email;
    private final String name;

    public AuthenticatedIdentity(String id, String email, String name) {
        this.id = id;
        this.email = email;
        this.name = name;
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    @Override
    public String toString() {
        return "AuthenticatedIdentity(" + id + ")";
    }
}
