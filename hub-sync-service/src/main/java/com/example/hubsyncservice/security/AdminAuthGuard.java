package com.example.hubsyncservice.security;

import com.example.hubsyncservice.exception.AuthenticationRequiredException;
import com.example.hubsyncservice.exception.AuthorizationDeniedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Gate for operator endpoints: only identities on the global admin allow-list.
 */
@Component
@RequiredArgsConstructor
public class AdminAuthGuard {

    private final IdentityProvider identityProvider;
    private final AdminAllowList adminAllowList;

    /**
     * @throws AuthenticationRequiredException when nobody is signed in
     * @throws AuthorizationDeniedException    when the caller is not an administrator
     */
    public AuthenticatedIdentity requireAdmin() {
        AuthenticatedIdentity identity = identityProvider.currentIdentity()
                .orElseThrow(AuthenticationRequiredException::notSignedIn);
        if (!adminAllowList.isAdmin(identity)) {
            throw AuthorizationDeniedException.notAnAdmin();
        }
        return identity;
    }
}
