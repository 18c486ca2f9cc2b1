package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Columns shared by every mirror table.
 *
 * Rows are keyed by (workspace_id, linear_id) and never by hub: which hub may see a row is
 * decided at read time from the current team mappings. {@code payload} is the upstream JSON
 * exactly as received; the other columns are extracted copies used for filtering and sorting.
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public abstract class MirrorRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workspace_id", nullable = false, length = 100)
    private String workspaceId;

    @Column(name = "linear_id", nullable = false, length = 100)
    private String linearId;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "synced_at", nullable = false)
    private Instant syncedAt;
}
