package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Tenant ("hub") granted a filtered view of the shared mirror.
 * Deactivated rather than deleted; an inactive hub fails every auth check.
 */
@Entity
@Table(name = "client_hubs",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_client_hubs_slug", columnNames = {"slug"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Hub extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "slug", nullable = false, length = 100)
    private String slug;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "external_org_id")
    private String externalOrgId;
}
