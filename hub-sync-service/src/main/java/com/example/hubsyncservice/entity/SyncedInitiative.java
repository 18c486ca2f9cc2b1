package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Organization-level entity: initiatives are not owned by a team.
 */
@Entity
@Table(name = "synced_initiatives",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_synced_initiatives_natural_key", columnNames = {"workspace_id", "linear_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class SyncedInitiative extends MirrorRow {

    @Column(name = "name")
    private String name;

    @Column(name = "status", length = 100)
    private String status;
}
