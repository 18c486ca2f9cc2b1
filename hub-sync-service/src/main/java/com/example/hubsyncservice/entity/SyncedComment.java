package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Entity
@Table(name = "synced_comments",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_synced_comments_natural_key", columnNames = {"workspace_id", "linear_id"})
        },
        indexes = {
                @Index(name = "idx_synced_comments_issue", columnList = "workspace_id,issue_linear_id")
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public class SyncedComment extends MirrorRow {

    @Column(name = "issue_linear_id", length = 100)
    private String issueLinearId;

    @Column(name = "author_name")
    private String authorName;
}
