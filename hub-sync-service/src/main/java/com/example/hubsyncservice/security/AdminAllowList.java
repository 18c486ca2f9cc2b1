package com.example.hubsyncservice.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Global administrators ({@code hub.admin.identity-ids}, comma separated). Members of this list
 * get the ADMIN role on every active hub without a membership row.
 */
@Component
public class AdminAllowList {

    private final Set<String> identityIds;

    public AdminAllowList(@Value("${hub.admin.identity-ids:}") String identityIds) {
        this.identityIds = Arrays.stream(identityIds.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isAdmin(AuthenticatedIdentity identity) {
        return identity != null && identityIds.contains(identity.getId());
    }
}
