package com.example.hubsyncservice.security;

import com.example.hubsyncservice.entity.Hub;
import com.example.hubsyncservice.entity.HubMember;
import com.example.hubsyncservice.entity.HubMember.MemberRole;
import com.example.hubsyncservice.repository.HubMemberRepository;
import com.example.hubsyncservice.repository.HubRepository;
import com.example.hubsyncservice.security.HubAuthResult.Denial;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Gate for every hub-scoped entry point.
 *
 * Order of checks:
 * 1. caller authenticated, else 401
 * 2. hub exists and is active, else 404
 * 3. membership by identity id
 * 4. pending invite with the caller's email (case-insensitive), claimed exactly once
 * 5. global admin allow-list, granted as ADMIN
 * 6. otherwise 403
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HubAuthGuard {

    private final IdentityProvider identityProvider;
    private final HubRepository hubRepository;
    private final HubMemberRepository memberRepository;
    private final AdminAllowList adminAllowList;
    private final Clock clock;

    @Transactional
    public HubAuthResult authorize(UUID hubId) {
        Optional<AuthenticatedIdentity> current = identityProvider.currentIdentity();
        if (current.isEmpty()) {
            return HubAuthResult.denied(hubId, Denial.UNAUTHENTICATED);
        }
        AuthenticatedIdentity identity = current.get();

        boolean hubActive = hubId != null && hubRepository.findById(hubId).map(Hub::isActive).orElse(false);
        if (!hubActive) {
            return HubAuthResult.denied(hubId, Denial.HUB_NOT_FOUND);
        }

        Optional<MemberRole> role = resolveMembership(hubId, identity);
        if (role.isPresent()) {
            return HubAuthResult.granted(identity, hubId, role.get());
        }

        if (adminAllowList.isAdmin(identity)) {
            log.debug("Admin bypass for hub {}: identityId={}", hubId, identity.getId());
            return HubAuthResult.granted(identity, hubId, MemberRole.ADMIN);
        }

        log.debug("Hub access denied: hubId={}, identityId={}", hubId, identity.getId());
        return HubAuthResult.denied(hubId, Denial.NOT_A_MEMBER);
    }

    @Transactional
    public HubAuthResult authorizeWrite(UUID hubId) {
        return authorize(hubId).requireWrite();
    }

    private Optional<MemberRole> resolveMembership(UUID hubId, AuthenticatedIdentity identity) {
        Optional<HubMember> byIdentity = memberRepository.findByHubIdAndIdentityId(hubId, identity.getId());
        if (byIdentity.isPresent()) {
            return byIdentity.map(HubMember::getRole);
        }
        if (!identity.hasEmail()) {
            return Optional.empty();
        }

        Optional<HubMember> invite = memberRepository.findPendingByHubIdAndEmail(hubId, identity.getEmail().trim());
        if (invite.isEmpty()) {
            return Optional.empty();
        }

        HubMember member = invite.get();
        int claimed = memberRepository.claimPending(member.getId(), identity.getId(), clock.instant());
        if (claimed != 1) {
            // Another request bound this invite first.
            log.warn("⚠️ Invite {} for hub {} was already claimed", member.getId(), hubId);
            return Optional.empty();
        }
        log.info("✅ Membership {} claimed: hubId={}, identityId={}", member.getId(), hubId, identity.getId());
        return Optional.of(member.getRole());
    }
}
