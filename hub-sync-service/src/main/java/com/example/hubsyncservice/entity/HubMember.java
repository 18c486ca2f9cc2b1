package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Hub membership. Created as a pending invite (email only) and claimed once the invited
 * identity first authenticates. A claimed membership is never re-bound to another identity.
 */
@Entity
@Table(name = "hub_members",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_hub_members_hub_identity", columnNames = {"hub_id", "identity_id"}),
                @UniqueConstraint(name = "uk_hub_members_hub_email", columnNames = {"hub_id", "email"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HubMember extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "hub_id", nullable = false)
    private UUID hubId;

    @Column(name = "identity_id")
    private String identityId;

    /** Stored lowercased. */
    @Column(name = "email", nullable = false)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    @Builder.Default
    private MemberRole role = MemberRole.DEFAULT;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private MembershipStatus status = MembershipStatus.PENDING;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    public boolean isPending() {
        return status == MembershipStatus.PENDING && identityId == null;
    }

    /**
     * Bind an identity to a pending invite.
     *
     * @throws IllegalStateException if the membership was already claimed
     */
    public void claim(String identityId, Instant now) {
        if (!isPending()) {
            throw new IllegalStateException("Membership " + id + " is already claimed");
        }
        this.identityId = identityId;
        this.status = MembershipStatus.CLAIMED;
        this.claimedAt = now;
    }

    public enum MemberRole {
        DEFAULT,
        VIEW_ONLY,
        ADMIN
    }

    public enum MembershipStatus {
        PENDING,
        CLAIMED
    }
}
