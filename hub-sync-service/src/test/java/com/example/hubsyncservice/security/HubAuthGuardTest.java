package com.example.hubsyncservice.security;

import com.example.hubsyncservice.entity.Hub;
import com.example.hubsyncservice.entity.HubMember;
import com.example.hubsyncservice.entity.HubMember.MemberRole;
import com.example.hubsyncservice.exception.AuthorizationDeniedException;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.repository.HubMemberRepository;
import com.example.hubsyncservice.repository.HubRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HubAuthGuardTest {

    private static final UUID HUB_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private IdentityProvider identityProvider;

    @Mock
    private HubRepository hubRepository;

    @Mock
    private HubMemberRepository memberRepository;

    private HubAuthGuard guard;

    @BeforeEach
    void setUp() {
        guard = new HubAuthGuard(identityProvider, hubRepository, memberRepository,
                new AdminAllowList("admin-1, admin-2"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testUnauthenticated_Returns401() {
        when(identityProvider.currentIdentity()).thenReturn(Optional.empty());

        HubAuthResult result = guard.authorize(HUB_ID);

        assertThat(result.isGranted()).isFalse();
        assertThat(result.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED);
        verify(hubRepository, never()).findById(any());
    }

    @Test
    void testMissingHub_Returns404() {
        signIn("user-1", "user@example.com");
        when(hubRepository.findById(HUB_ID)).thenReturn(Optional.empty());

        HubAuthResult result = guard.authorize(HUB_ID);

        assertThat(result.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThatThrownBy(result::orElseThrow).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void testInactiveHub_Returns404EvenForAdmins() {
        signIn("admin-1", null);
        when(hubRepository.findById(HUB_ID)).thenReturn(Optional.of(hub(false)));

        HubAuthResult result = guard.authorize(HUB_ID);

        assertThat(result.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void testMemberByIdentity_GrantedWithStoredRole() {
        signIn("user-1", "user@example.com");
        activeHub();
        when(memberRepository.findByHubIdAndIdentityId(HUB_ID, "user-1"))
                .thenReturn(Optional.of(member(MemberRole.DEFAULT, "user-1")));

        HubAccess access = guard.authorize(HUB_ID).orElseThrow();

        assertThat(access.role()).isEqualTo(MemberRole.DEFAULT);
        assertThat(access.canWrite()).isTrue();
        verify(memberRepository, never()).claimPending(any(), anyString(), any());
    }

    @Test
    void testPendingInvite_ClaimedOnFirstRequest() {
        signIn("user-2", "Invitee@Example.com");
        activeHub();
        HubMember invite = member(MemberRole.VIEW_ONLY, null);
        when(memberRepository.findByHubIdAndIdentityId(HUB_ID, "user-2")).thenReturn(Optional.empty());
        when(memberRepository.findPendingByHubIdAndEmail(HUB_ID, "Invitee@Example.com")).thenReturn(Optional.of(invite));
        when(memberRepository.claimPending(invite.getId(), "user-2", NOW)).thenReturn(1);

        HubAuthResult result = guard.authorize(HUB_ID);

        assertThat(result.isGranted()).isTrue();
        assertThat(result.getAccess().role()).isEqualTo(MemberRole.VIEW_ONLY);
        verify(memberRepository).claimPending(invite.getId(), "user-2", NOW);
    }

    @Test
    void testInviteAlreadyClaimedByAnotherIdentity_Denied() {
        signIn("user-3", "invitee@example.com");
        activeHub();
        HubMember invite = member(MemberRole.DEFAULT, null);
        when(memberRepository.findByHubIdAndIdentityId(HUB_ID, "user-3")).thenReturn(Optional.empty());
        when(memberRepository.findPendingByHubIdAndEmail(HUB_ID, "invitee@example.com")).thenReturn(Optional.of(invite));
        when(memberRepository.claimPending(invite.getId(), "user-3", NOW)).thenReturn(0);

        HubAuthResult result = guard.authorize(HUB_ID);

        assertThat(result.getStatus()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(result.getDenial()).isEqualTo(HubAuthResult.Denial.NOT_A_MEMBER);
    }

    @Test
    void testGlobalAdminWithoutMembership_GrantedAsAdmin() {
        signIn("admin-2", null);
        activeHub();
        when(memberRepository.findByHubIdAndIdentityId(HUB_ID, "admin-2")).thenReturn(Optional.empty());

        HubAccess access = guard.authorize(HUB_ID).orElseThrow();

        assertThat(access.role()).isEqualTo(MemberRole.ADMIN);
    }

    @Test
    void testStranger_Returns403() {
        signIn("user-9", "stranger@example.com");
        activeHub();
        when(memberRepository.findByHubIdAndIdentityId(HUB_ID, "user-9")).thenReturn(Optional.empty());
        when(memberRepository.findPendingByHubIdAndEmail(HUB_ID, "stranger@example.com")).thenReturn(Optional.empty());

        HubAuthResult result = guard.authorize(HUB_ID);

        assertThat(result.getStatus()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThatThrownBy(result::orElseThrow).isInstanceOf(AuthorizationDeniedException.class);
    }

    @Test
    void testWriteVariant_ViewOnlyDenied_OthersGranted() {
        signIn("viewer", "viewer@example.com");
        activeHub();
        when(memberRepository.findByHubIdAndIdentityId(HUB_ID, "viewer"))
                .thenReturn(Optional.of(member(MemberRole.VIEW_ONLY, "viewer")));

        assertThat(guard.authorize(HUB_ID).isGranted()).isTrue();

        HubAuthResult write = guard.authorizeWrite(HUB_ID);
        assertThat(write.getStatus()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(write.getDenial()).isEqualTo(HubAuthResult.Denial.VIEW_ONLY);
    }

    private void signIn(String id, String email) {
        when(identityProvider.currentIdentity()).thenReturn(Optional.of(new AuthenticatedIdentity(id, email, "Test User")));
    }

    private void activeHub() {
        when(hubRepository.findById(HUB_ID)).thenReturn(Optional.of(hub(true)));
    }

    private static Hub hub(boolean active) {
        return Hub.builder().id(HUB_ID).name("Alpha").slug("alpha").active(active).build();
    }

    private static HubMember member(MemberRole role, String identityId) {
        return HubMember.builder()
                .id(UUID.randomUUID())
                .hubId(HUB_ID)
                .identityId(identityId)
                .email("invitee@example.com")
                .role(role)
                .build();
    }
}
