package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.HubMember;
import com.example.hubsyncservice.entity.HubMember.MembershipStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HubMemberRepository extends JpaRepository<HubMember, UUID> {

    Optional<HubMember> findByHubIdAndIdentityId(UUID hubId, String identityId);

    Optional<HubMember> findFirstByHubIdAndIdentityIdIsNullAndStatusAndEmailIgnoreCase(
            UUID hubId, MembershipStatus status, String email);

    /**
     * Pending invite for the email, not yet bound to any identity.
     */
    default Optional<HubMember> findPendingByHubIdAndEmail(UUID hubId, String email) {
        return findFirstByHubIdAndIdentityIdIsNullAndStatusAndEmailIgnoreCase(hubId, MembershipStatus.PENDING, email);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE HubMember m
            SET m.identityId = :identityId,
                m.status = :claimed,
                m.claimedAt = :claimedAt,
                m.updatedAt = :claimedAt
            WHERE m.id = :memberId
              AND m.identityId IS NULL
              AND m.status = :pending
            """)
    int updateClaim(@Param("memberId") UUID memberId,
                    @Param("identityId") String identityId,
                    @Param("claimedAt") Instant claimedAt,
                    @Param("claimed") MembershipStatus claimed,
                    @Param("pending") MembershipStatus pending);

    /**
     * Pending → Claimed, once. The WHERE clause turns a second or concurrent claim into a no-op
     * that returns 0.
     */
    default int claimPending(UUID memberId, String identityId, Instant claimedAt) {
        return updateClaim(memberId, identityId, claimedAt, MembershipStatus.CLAIMED, MembershipStatus.PENDING);
    }

    boolean existsByHubIdAndEmailIgnoreCase(UUID hubId, String email);

    List<HubMember> findByHubIdOrderByCreatedAtAsc(UUID hubId);

    Optional<HubMember> findByIdAndHubId(UUID id, UUID hubId);
}
