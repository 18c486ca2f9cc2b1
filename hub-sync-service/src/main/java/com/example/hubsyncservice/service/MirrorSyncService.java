package com.example.hubsyncservice.service;

import com.example.hubsyncservice.client.external.LinearClient;
import com.example.hubsyncservice.dto.SyncCounts;
import com.example.hubsyncservice.dto.TeamSyncResult;
import com.example.hubsyncservice.entity.MirrorRow;
import com.example.hubsyncservice.metrics.SyncMetrics;
import com.example.hubsyncservice.repository.MirrorBatchUpserter;
import com.example.hubsyncservice.repository.MirrorTable;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Fetch → map → upsert steps shared by the full sync and the reconciler.
 *
 * CRITICAL DESIGN:
 * - Upstream calls happen OUTSIDE transactions; each upsert chunk commits on its own
 * - A team step never throws: its failure is caught, counted and returned in the result
 * - {@code since == null} means everything, otherwise only entities updated at or after it
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MirrorSyncService {

    private final LinearClient linearClient;
    private final MirrorRowMapper rowMapper;
    private final MirrorBatchUpserter upserter;
    private final SyncMetrics syncMetrics;

    /**
     * Teams and initiatives, once per run. A team failure counts as an error; an initiative
     * failure is only a warning because the token may lack org-level scope.
     */
    public void syncOrgLevel(String token, Instant since, SyncCounts counts) {
        try {
            List<JsonNode> teams = linearClient.fetchTeams(token, since);
            counts.addTeams(upsertAll(MirrorTable.TEAMS, teams, rowMapper::toTeam));
        } catch (RuntimeException e) {
            counts.recordError();
            log.error("❌ Team sync failed: {}", e.getMessage(), e);
        }

        try {
            List<JsonNode> initiatives = linearClient.fetchInitiatives(token, since);
            counts.addInitiatives(upsertAll(MirrorTable.INITIATIVES, initiatives, rowMapper::toInitiative));
        } catch (RuntimeException e) {
            log.warn("⚠️ Initiative sync failed (token may lack org scope): {}", e.getMessage());
        }
    }

    /**
     * Full team sync: projects, cycles, issues, then the comments of every fetched issue. A failing
     * issue's comments are counted as one error and the loop moves on.
     */
    public TeamSyncResult syncTeam(String token, String teamId, String teamName) {
        TeamSyncResult result = newResult(teamId, teamName);
        try {
            List<JsonNode> issues = syncTeamEntities(token, teamId, null, result);

            for (JsonNode issue : issues) {
                String issueId = UpstreamPayloads.text(issue, "id");
                try {
                    List<JsonNode> comments = linearClient.fetchComments(token, issueId);
                    result.setComments(result.getComments()
                            + upsertAll(MirrorTable.COMMENTS, comments, c -> rowMapper.toComment(c, issueId)));
                } catch (RuntimeException e) {
                    result.setErrors(result.getErrors() + 1);
                    log.error("❌ Comments for issue {} of team {} failed: {}", issueId, teamId, e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            fail(result, e);
        }
        return result;
    }

    /**
     * Incremental team sync: projects, cycles, issues and comments changed since the watermark.
     */
    public TeamSyncResult reconcileTeam(String token, String teamId, String teamName, Instant since) {
        TeamSyncResult result = newResult(teamId, teamName);
        try {
            syncTeamEntities(token, teamId, since, result);

            List<JsonNode> comments = linearClient.fetchCommentsForTeam(token, teamId, since);
            result.setComments(upsertAll(MirrorTable.COMMENTS, comments, rowMapper::toComment));
        } catch (RuntimeException e) {
            fail(result, e);
        }
        return result;
    }

    private List<JsonNode> syncTeamEntities(String token, String teamId, Instant since, TeamSyncResult result) {
        List<JsonNode> projects = linearClient.fetchProjects(token, teamId, since);
        result.setProjects(upsertAll(MirrorTable.PROJECTS, projects, rowMapper::toProject));

        List<JsonNode> cycles = linearClient.fetchCycles(token, teamId, since);
        result.setCycles(upsertAll(MirrorTable.CYCLES, cycles, rowMapper::toCycle));

        List<JsonNode> issues = linearClient.fetchIssues(token, teamId, since);
        result.setIssues(upsertAll(MirrorTable.ISSUES, issues, rowMapper::toIssue));
        return issues;
    }

    private <T extends MirrorRow> int upsertAll(MirrorTable<T> table, List<JsonNode> nodes, Function<JsonNode, T> mapper) {
        if (nodes.isEmpty()) {
            return 0;
        }
        List<T> rows = nodes.stream().map(mapper).toList();
        upserter.upsert(table, rows);
        return rows.size();
    }

    private TeamSyncResult newResult(String teamId, String teamName) {
        return TeamSyncResult.builder()
                .teamId(teamId)
                .teamName(teamName)
                .success(true)
                .build();
    }

    private void fail(TeamSyncResult result, RuntimeException e) {
        result.setSuccess(false);
        result.setErrors(result.getErrors() + 1);
        result.setErrorMessage(e.getMessage());
        syncMetrics.recordTeamFailure();
        log.error("❌ Sync of team {} failed: {}", result.getTeamId(), e.getMessage(), e);
    }

    /**
     * Fold a team result into run counters.
     */
    public static void accumulate(SyncCounts counts, TeamSyncResult result) {
        counts.addProjects(result.getProjects());
        counts.addIssues(result.getIssues());
        counts.addComments(result.getComments());
        counts.addCycles(result.getCycles());
        for (int i = 0; i < result.getErrors(); i++) {
            counts.recordError();
        }
    }
}
