package com.example.hubsyncservice.webhook;

import com.example.hubsyncservice.cache.TeamHubMappingCache;
import com.example.hubsyncservice.entity.MirrorRow;
import com.example.hubsyncservice.entity.SyncedIssue;
import com.example.hubsyncservice.metrics.SyncMetrics;
import com.example.hubsyncservice.repository.MirrorBatchUpserter;
import com.example.hubsyncservice.repository.MirrorTable;
import com.example.hubsyncservice.repository.SyncedIssueRepository;
import com.example.hubsyncservice.service.MirrorRowMapper;
import com.example.hubsyncservice.service.UpstreamPayloads;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Applies a verified webhook event to the mirror.
 *
 * Relevance: issues and comments resolve to a team; if that team is not tracked by any active
 * hub (or cannot be resolved) the event is dropped without touching the mirror. Projects are
 * kept when any of their teams is tracked or when the payload carries no team information.
 * Initiatives are org level and always applied. An issue update that moves a mirrored issue
 * out of every tracked team deletes the mirrored row instead of being dropped.
 *
 * {@code create} and {@code update} share one upsert path, so out-of-order delivery converges;
 * {@code remove} deletes by natural key.
 *
 * Never throws: handler errors become {@link WebhookOutcome#FAILED}.
 */
@Component
@Slf4j
public class WebhookEventRouter {

    private final TeamHubMappingCache mappingCache;
    private final MirrorRowMapper rowMapper;
    private final MirrorBatchUpserter upserter;
    private final SyncedIssueRepository issueRepository;
    private final SyncMetrics syncMetrics;
    private final String workspaceId;

    public WebhookEventRouter(TeamHubMappingCache mappingCache,
                              MirrorRowMapper rowMapper,
                              MirrorBatchUpserter upserter,
                              SyncedIssueRepository issueRepository,
                              SyncMetrics syncMetrics,
                              @Value("${hub.workspace-id:workspace}") String workspaceId) {
        this.mappingCache = mappingCache;
        this.rowMapper = rowMapper;
        this.upserter = upserter;
        this.issueRepository = issueRepository;
        this.syncMetrics = syncMetrics;
        this.workspaceId = workspaceId;
    }

    public WebhookOutcome route(WebhookEvent event) {
        WebhookOutcome outcome;
        try {
            outcome = dispatch(event);
        } catch (RuntimeException e) {
            log.error("❌ Webhook handler failed: type={}, action={}, id={}",
                    event.rawType(), event.action(), event.entityId(), e);
            outcome = WebhookOutcome.FAILED;
        }
        syncMetrics.recordWebhookEvent(outcome);
        return outcome;
    }

    private WebhookOutcome dispatch(WebhookEvent event) {
        if (event.action() == WebhookAction.UNKNOWN) {
            log.info("Ignoring webhook with unknown action for type {}", event.rawType());
            return WebhookOutcome.IGNORED;
        }
        if (event.entityType() != WebhookEntityType.UNHANDLED && event.entityId() == null) {
            log.warn("⚠️ Ignoring {} webhook without data.id", event.rawType());
            return WebhookOutcome.IGNORED;
        }

        return switch (event.entityType()) {
            case ISSUE -> routeIssue(event);
            case COMMENT -> isTracked(resolveCommentTeam(event.data()))
                    ? apply(event, MirrorTable.COMMENTS, rowMapper::toComment)
                    : dropped(event);
            case PROJECT -> isProjectRelevant(event.data())
                    ? apply(event, MirrorTable.PROJECTS, rowMapper::toProject)
                    : dropped(event);
            case INITIATIVE -> apply(event, MirrorTable.INITIATIVES, rowMapper::toInitiative);
            case UNHANDLED -> {
                log.info("Ignoring unhandled webhook event type: {}", event.rawType());
                yield WebhookOutcome.IGNORED;
            }
        };
    }

    private WebhookOutcome routeIssue(WebhookEvent event) {
        if (isTracked(UpstreamPayloads.issueTeamId(event.data()))) {
            return apply(event, MirrorTable.ISSUES, rowMapper::toIssue);
        }
        if (event.action() == WebhookAction.UPDATE && isMirroredUnderTrackedTeam(event.entityId())) {
            // Moved to an untracked team: the reconciler filters by team and would never revisit the row.
            upserter.deleteByNaturalKey(MirrorTable.ISSUES, workspaceId, event.entityId());
            log.info("Issue {} moved to untracked team {}; removed from the mirror",
                    event.entityId(), UpstreamPayloads.issueTeamId(event.data()));
            return WebhookOutcome.PROCESSED;
        }
        return dropped(event);
    }

    private <T extends MirrorRow> WebhookOutcome apply(WebhookEvent event,
                                                       MirrorTable<T> table,
                                                       Function<JsonNode, T> mapper) {
        if (event.action() == WebhookAction.REMOVE) {
            int deleted = upserter.deleteByNaturalKey(table, workspaceId, event.entityId());
            log.debug("Webhook remove {} {}: {} row(s) deleted", event.rawType(), event.entityId(), deleted);
        } else {
            upserter.upsert(table, List.of(mapper.apply(event.data())));
            log.debug("Webhook {} {} {} upserted", event.action(), event.rawType(), event.entityId());
        }
        return WebhookOutcome.PROCESSED;
    }

    private WebhookOutcome dropped(WebhookEvent event) {
        log.debug("Dropping {} {} for untracked team", event.rawType(), event.entityId());
        return WebhookOutcome.DROPPED_UNTRACKED;
    }

    private boolean isTracked(String teamId) {
        return teamId != null && mappingCache.isTeamTracked(teamId);
    }

    private boolean isMirroredUnderTrackedTeam(String issueId) {
        return issueRepository.findByWorkspaceIdAndLinearId(workspaceId, issueId)
                .map(SyncedIssue::getTeamId)
                .filter(this::isTracked)
                .isPresent();
    }

    /**
     * The comment's own issue team when the payload carries it, else the team of the mirrored
     * parent issue.
     */
    private String resolveCommentTeam(JsonNode comment) {
        String teamId = UpstreamPayloads.commentTeamId(comment);
        if (teamId != null) {
            return teamId;
        }
        String issueId = UpstreamPayloads.commentIssueId(comment);
        if (issueId == null) {
            return null;
        }
        return issueRepository.findByWorkspaceIdAndLinearId(workspaceId, issueId)
                .map(SyncedIssue::getTeamId)
                .orElse(null);
    }

    private boolean isProjectRelevant(JsonNode project) {
        List<String> teamIds = UpstreamPayloads.projectTeamIds(project);
        return teamIds.isEmpty() || teamIds.stream().anyMatch(mappingCache::isTeamTracked);
    }
}
