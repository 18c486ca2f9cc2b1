package com.example.hubsyncservice.security;

import java.util.Optional;

/**
 * Resolves the identity behind the current request. Sign-in itself is handled by the external
 * identity provider that issues the bearer tokens.
 */
public interface IdentityProvider {

    Optional<AuthenticatedIdentity> currentIdentity();
}
