package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Entity
@Table(name = "synced_teams",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_synced_teams_natural_key", columnNames = {"workspace_id", "linear_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class SyncedTeam extends MirrorRow {

    @Column(name = "name")
    private String name;

    @Column(name = "team_key", length = 50)
    private String teamKey;

    @Column(name = "parent_team_id", length = 100)
    private String parentTeamId;
}
