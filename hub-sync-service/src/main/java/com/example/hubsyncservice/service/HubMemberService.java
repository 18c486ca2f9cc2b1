package com.example.hubsyncservice.service;

import com.example.hubsyncservice.dto.request.InviteMemberRequest;
import com.example.hubsyncservice.dto.response.HubMemberResponse;
import com.example.hubsyncservice.entity.HubMember;
import com.example.hubsyncservice.entity.HubMember.MemberRole;
import com.example.hubsyncservice.exception.ConflictException;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.repository.HubMemberRepository;
import com.example.hubsyncservice.repository.HubRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Hub memberships. Invites are stored as pending rows keyed by lowercased email and claimed by
 * the auth guard on the invitee's first authenticated request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HubMemberService {

    private final HubRepository hubRepository;
    private final HubMemberRepository memberRepository;

    @Transactional(readOnly = true)
    public List<HubMemberResponse> listMembers(UUID hubId) {
        requireHub(hubId);
        return memberRepository.findByHubIdOrderByCreatedAtAsc(hubId).stream()
                .map(HubMemberResponse::from)
                .toList();
    }

    @Transactional
    public HubMemberResponse invite(UUID hubId, InviteMemberRequest request) {
        requireHub(hubId);
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (memberRepository.existsByHubIdAndEmailIgnoreCase(hubId, email)) {
            throw ConflictException.memberExists(email);
        }

        HubMember member = memberRepository.save(HubMember.builder()
                .hubId(hubId)
                .email(email)
                .role(request.role() == null ? MemberRole.DEFAULT : request.role())
                .build());
        log.info("✅ Invited {} to hub {} as {}", email, hubId, member.getRole());
        return HubMemberResponse.from(member);
    }

    @Transactional
    public HubMemberResponse changeRole(UUID hubId, UUID memberId, MemberRole role) {
        HubMember member = load(hubId, memberId);
        member.setRole(role);
        return HubMemberResponse.from(memberRepository.save(member));
    }

    @Transactional
    public void remove(UUID hubId, UUID memberId) {
        HubMember member = load(hubId, memberId);
        memberRepository.delete(member);
        log.warn("Member {} ({}) removed from hub {}", memberId, member.getEmail(), hubId);
    }

    private HubMember load(UUID hubId, UUID memberId) {
        return memberRepository.findByIdAndHubId(memberId, hubId)
                .orElseThrow(() -> ResourceNotFoundException.member(memberId));
    }

    private void requireHub(UUID hubId) {
        if (!hubRepository.existsById(hubId)) {
            throw ResourceNotFoundException.hub(hubId);
        }
    }
}
