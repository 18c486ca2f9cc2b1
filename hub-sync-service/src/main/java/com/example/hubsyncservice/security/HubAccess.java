package com.example.hubsyncservice.security;

import com.example.hubsyncservice.entity.HubMember.MemberRole;

import java.util.UUID;

/**
 * Granted access to one hub.
 */
public record HubAccess(AuthenticatedIdentity identity, UUID hubId, MemberRole role) {

    public boolean canWrite() {
        return role != MemberRole.VIEW_ONLY;
    }
}
