package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.*;
import org.hibernate.type.BasicTypeReference;
import org.hibernate.type.StandardBasicTypes;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Describes how one mirror table is written by {@link MirrorBatchUpserter}: table name,
 * natural-key columns and the typed value of every column for a row.
 *
 * @param <T> mirror row type
 */
public final class MirrorTable<T extends MirrorRow> {

    static final List<String> NATURAL_KEY = List.of("workspace_id", "linear_id");

    public static final MirrorTable<SyncedTeam> TEAMS = MirrorTable.<SyncedTeam>builder("synced_teams")
            .column("name", StandardBasicTypes.STRING, SyncedTeam::getName)
            .column("team_key", StandardBasicTypes.STRING, SyncedTeam::getTeamKey)
            .column("parent_team_id", StandardBasicTypes.STRING, SyncedTeam::getParentTeamId)
            .build();

    public static final MirrorTable<SyncedProject> PROJECTS = MirrorTable.<SyncedProject>builder("synced_projects")
            .column("name", StandardBasicTypes.STRING, SyncedProject::getName)
            .column("state_name", StandardBasicTypes.STRING, SyncedProject::getStateName)
            .column("team_ids", StandardBasicTypes.STRING,
                    p -> new StringListConverter().convertToDatabaseColumn(p.getTeamIds()))
            .build();

    public static final MirrorTable<SyncedIssue> ISSUES = MirrorTable.<SyncedIssue>builder("synced_issues")
            .column("identifier", StandardBasicTypes.STRING, SyncedIssue::getIdentifier)
            .column("title", StandardBasicTypes.STRING, SyncedIssue::getTitle)
            .column("state_name", StandardBasicTypes.STRING, SyncedIssue::getStateName)
            .column("priority", StandardBasicTypes.INTEGER, SyncedIssue::getPriority)
            .column("assignee_name", StandardBasicTypes.STRING, SyncedIssue::getAssigneeName)
            .column("team_id", StandardBasicTypes.STRING, SyncedIssue::getTeamId)
            .column("project_id", StandardBasicTypes.STRING, SyncedIssue::getProjectId)
            .build();

    public static final MirrorTable<SyncedComment> COMMENTS = MirrorTable.<SyncedComment>builder("synced_comments")
            .column("issue_linear_id", StandardBasicTypes.STRING, SyncedComment::getIssueLinearId)
            .column("author_name", StandardBasicTypes.STRING, SyncedComment::getAuthorName)
            .build();

    public static final MirrorTable<SyncedCycle> CYCLES = MirrorTable.<SyncedCycle>builder("synced_cycles")
            .column("name", StandardBasicTypes.STRING, SyncedCycle::getName)
            .column("cycle_number", StandardBasicTypes.INTEGER, SyncedCycle::getNumber)
            .column("team_id", StandardBasicTypes.STRING, SyncedCycle::getTeamId)
            .column("starts_at", StandardBasicTypes.TIMESTAMP, c -> Builder.toTimestamp(c.getStartsAt()))
            .column("ends_at", StandardBasicTypes.TIMESTAMP, c -> Builder.toTimestamp(c.getEndsAt()))
            .build();

    public static final MirrorTable<SyncedInitiative> INITIATIVES = MirrorTable.<SyncedInitiative>builder("synced_initiatives")
            .column("name", StandardBasicTypes.STRING, SyncedInitiative::getName)
            .column("status", StandardBasicTypes.STRING, SyncedInitiative::getStatus)
            .build();

    private final String tableName;
    private final List<Column<T, ?>> columns;

    private MirrorTable(String tableName, List<Column<T, ?>> columns) {
        this.tableName = tableName;
        this.columns = List.copyOf(columns);
    }

    public String tableName() {
        return tableName;
    }

    List<Column<T, ?>> columns() {
        return columns;
    }

    List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    static <T extends MirrorRow> Builder<T> builder(String tableName) {
        return new Builder<>(tableName);
    }

    record Column<T, V>(String name, BasicTypeReference<V> type, Function<T, V> getter) {

        V valueOf(T row) {
            return getter.apply(row);
        }
    }

    static final class Builder<T extends MirrorRow> {

        private final String tableName;
        private final List<Column<T, ?>> columns = new ArrayList<>();

        private Builder(String tableName) {
            this.tableName = tableName;
            // Shared columns first; the natural key must stay the first two entries.
            column("workspace_id", StandardBasicTypes.STRING, MirrorRow::getWorkspaceId);
            column("linear_id", StandardBasicTypes.STRING, MirrorRow::getLinearId);
            column("payload", StandardBasicTypes.STRING, MirrorRow::getPayload);
            column("created_at", StandardBasicTypes.TIMESTAMP, row -> toTimestamp(row.getCreatedAt()));
            column("updated_at", StandardBasicTypes.TIMESTAMP, row -> toTimestamp(row.getUpdatedAt()));
            column("synced_at", StandardBasicTypes.TIMESTAMP, row -> toTimestamp(row.getSyncedAt()));
        }

        <V> Builder<T> column(String name, BasicTypeReference<V> type, Function<? super T, ? extends V> getter) {
            columns.add(new Column<T, V>(name, type, getter::apply));
            return this;
        }

        MirrorTable<T> build() {
            return new MirrorTable<>(tableName, columns);
        }

        static Timestamp toTimestamp(Instant instant) {
            return instant == null ? null : Timestamp.from(instant);
        }
    }
}
