package com.example.hubsyncservice.dto.response;

import com.example.hubsyncservice.entity.HubMember;
import com.example.hubsyncservice.entity.HubMember.MemberRole;
import com.example.hubsyncservice.entity.HubMember.MembershipStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HubMemberResponse {

    private UUID id;
    private UUID hubId;
    private String email;
    private String identityId;
    private MemberRole role;
    private MembershipStatus status;
    private Instant claimedAt;
    private Instant createdAt;

    public static HubMemberResponse from(HubMember member) {
        return HubMemberResponse.builder()
                .id(member.getId())
                .hubId(member.getHubId())
                .email(member.getEmail())
                .identityId(member.getIdentityId())
                .role(member.getRole())
                .status(member.getStatus())
                .claimedAt(member.getClaimedAt())
                .createdAt(member.getCreatedAt())
                .build();
    }
}
