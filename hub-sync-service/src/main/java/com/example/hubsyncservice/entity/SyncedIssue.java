package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Mirrored issue. {@code assigneeName} is kept for operators only; hub projections never
 * expose it.
 */
@Entity
@Table(name = "synced_issues",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_synced_issues_natural_key", columnNames = {"workspace_id", "linear_id"})
        },
        indexes = {
                @Index(name = "idx_synced_issues_team", columnList = "workspace_id,team_id"),
                @Index(name = "idx_synced_issues_project", columnList = "project_id"),
                @Index(name = "idx_synced_issues_updated_at", columnList = "updated_at")
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class SyncedIssue extends MirrorRow {

    @Column(name = "identifier", length = 50)
    private String identifier;

    @Column(name = "title", length = 1000)
    private String title;

    @Column(name = "state_name", length = 100)
    private String stateName;

    @Column(name = "priority")
    private Integer priority;

    @Column(name = "assignee_name")
    private String assigneeName;

    @Column(name = "team_id", length = 100)
    private String teamId;

    @Column(name = "project_id", length = 100)
    private String projectId;
}
