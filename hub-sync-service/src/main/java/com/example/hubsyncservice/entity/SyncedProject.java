package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "synced_projects",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_synced_projects_natural_key", columnNames = {"workspace_id", "linear_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class SyncedProject extends MirrorRow {

    @Column(name = "name")
    private String name;

    @Column(name = "state_name", length = 100)
    private String stateName;

    /** Upstream teams the project belongs to. A project can span several teams. */
    @Convert(converter = StringListConverter.class)
    @Column(name = "team_ids", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> teamIds = new ArrayList<>();
}
