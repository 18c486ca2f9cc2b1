package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Mirrored cycle (time-boxed iteration). A cycle belongs to exactly one team.
 */
@Entity
@Table(name = "synced_cycles",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_synced_cycles_natural_key", columnNames = {"workspace_id", "linear_id"})
        },
        indexes = {
                @Index(name = "idx_synced_cycles_team", columnList = "workspace_id,team_id")
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class SyncedCycle extends MirrorRow {

    @Column(name = "name")
    private String name;

    @Column(name = "cycle_number")
    private Integer number;

    @Column(name = "team_id", length = 100)
    private String teamId;

    @Column(name = "starts_at")
    private Instant startsAt;

    @Column(name = "ends_at")
    private Instant endsAt;
}
