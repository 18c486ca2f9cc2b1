package com.example.hubsyncservice.service;

import com.example.hubsyncservice.cache.TeamHubMappingCache;
import com.example.hubsyncservice.dto.response.*;
import com.example.hubsyncservice.entity.SyncedComment;
import com.example.hubsyncservice.entity.SyncedCycle;
import com.example.hubsyncservice.entity.SyncedInitiative;
import com.example.hubsyncservice.entity.SyncedIssue;
import com.example.hubsyncservice.entity.SyncedProject;
import com.example.hubsyncservice.entity.SyncedTeam;
import com.example.hubsyncservice.exception.ResourceNotFoundException;
import com.example.hubsyncservice.repository.SyncedCommentRepository;
import com.example.hubsyncservice.repository.SyncedCycleRepository;
import com.example.hubsyncservice.repository.SyncedInitiativeRepository;
import com.example.hubsyncservice.repository.SyncedIssueRepository;
import com.example.hubsyncservice.repository.SyncedProjectRepository;
import com.example.hubsyncservice.repository.SyncedTeamRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Hub-scoped reads over the shared mirror.
 *
 * Every query is bounded by the hub's effective team set from {@link TeamHubMappingCache}; a
 * caller-supplied team id outside that set yields an empty result, never a broader one. The
 * caller must already have passed the hub auth guard.
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class HubReadService {

    private final TeamHubMappingCache mappingCache;
    private final SyncedIssueRepository issueRepository;
    private final SyncedCommentRepository commentRepository;
    private final SyncedTeamRepository teamRepository;
    private final SyncedProjectRepository projectRepository;
    private final SyncedInitiativeRepository initiativeRepository;
    private final SyncedCycleRepository cycleRepository;
    private final ObjectMapper objectMapper;
    private final String workspaceId;

    public HubReadService(TeamHubMappingCache mappingCache,
                          SyncedIssueRepository issueRepository,
                          SyncedCommentRepository commentRepository,
                          SyncedTeamRepository teamRepository,
                          SyncedProjectRepository projectRepository,
                          SyncedInitiativeRepository initiativeRepository,
                          SyncedCycleRepository cycleRepository,
                          ObjectMapper objectMapper,
                          @Value("${hub.workspace-id:workspace}") String workspaceId) {
        this.mappingCache = mappingCache;
        this.issueRepository = issueRepository;
        this.commentRepository = commentRepository;
        this.teamRepository = teamRepository;
        this.projectRepository = projectRepository;
        this.initiativeRepository = initiativeRepository;
        this.cycleRepository = cycleRepository;
        this.objectMapper = objectMapper;
        this.workspaceId = workspaceId;
    }

    /**
     * Optional narrowing of an issue listing. Null or empty fields do not narrow.
     */
    public record IssueFilter(String teamId, String projectId, List<String> states) {

        public static IssueFilter none() {
            return new IssueFilter(null, null, List.of());
        }
    }

    public HubVisibility visibility(UUID hubId) {
        return new HubVisibility(mappingCache.mappingsForHub(hubId));
    }

    public List<HubIssueDto> listIssues(UUID hubId, IssueFilter filter) {
        HubVisibility visibility = visibility(hubId);
        Set<String> teamIds = scopeTeams(visibility, filter.teamId());
        if (teamIds.isEmpty()) {
            return List.of();
        }
        if (filter.projectId() != null && !visibility.isProjectVisible(filter.projectId())) {
            return List.of();
        }

        List<HubIssueDto> issues = new ArrayList<>();
        for (SyncedIssue issue : issueRepository.findByWorkspaceIdAndTeamIdInOrderByUpdatedAtDesc(workspaceId, teamIds)) {
            if (filter.projectId() != null && !filter.projectId().equals(issue.getProjectId())) {
                continue;
            }
            if (filter.states() != null && !filter.states().isEmpty() && !filter.states().contains(issue.getStateName())) {
                continue;
            }
            JsonNode payload = parse(issue.getPayload());
            if (isVisible(visibility, issue, payload)) {
                issues.add(toIssueDto(visibility, issue, payload));
            }
        }
        return issues;
    }

    /**
     * @throws ResourceNotFoundException when the issue is not in the mirror, belongs to another
     *                                   hub's team, or is hidden by this hub's visibility rules
     */
    public HubIssueDetailDto getIssue(UUID hubId, String issueId) {
        HubVisibility visibility = visibility(hubId);
        SyncedIssue issue = findVisibleIssue(visibility, issueId);
        JsonNode payload = parse(issue.getPayload());
        return new HubIssueDetailDto(toIssueDto(visibility, issue, payload), comments(issueId));
    }

    public List<HubCommentDto> listComments(UUID hubId, String issueId) {
        findVisibleIssue(visibility(hubId), issueId);
        return comments(issueId);
    }

    /**
     * The issue if the hub may see it; the write path uses this before touching upstream.
     */
    public SyncedIssue requireVisibleIssue(UUID hubId, String issueId) {
        return findVisibleIssue(visibility(hubId), issueId);
    }

    public List<HubTeamDto> listTeams(UUID hubId) {
        HubVisibility visibility = visibility(hubId);
        if (visibility.isEmpty()) {
            return List.of();
        }

        Map<String, HubTeamDto> teams = new LinkedHashMap<>();
        for (SyncedTeam team : teamRepository.findByWorkspaceIdAndLinearIdInOrderByNameAsc(workspaceId, visibility.teamIds())) {
            teams.put(team.getLinearId(), new HubTeamDto(team.getLinearId(), team.getName(), team.getTeamKey()));
        }
        // Mapped but not mirrored yet: fall back to the name stored on the mapping.
        for (String teamId : visibility.teamIds()) {
            teams.computeIfAbsent(teamId, id -> new HubTeamDto(id,
                    visibility.mappingFor(id).map(m -> m.getTeamName()).orElse(null), null));
        }
        return new ArrayList<>(teams.values());
    }

    public List<HubProjectDto> listProjects(UUID hubId, String stateName) {
        HubVisibility visibility = visibility(hubId);
        if (visibility.isEmpty()) {
            return List.of();
        }

        Optional<Set<String>> allowed = visibility.allowedProjectIds();
        List<SyncedProject> candidates = allowed
                .map(ids -> ids.isEmpty() ? List.<SyncedProject>of()
                        : projectRepository.findByWorkspaceIdAndLinearIdInOrderByNameAsc(workspaceId, ids))
                .orElseGet(() -> projectRepository.findByWorkspaceIdOrderByNameAsc(workspaceId));

        return candidates.stream()
                .filter(project -> project.getTeamIds().stream().anyMatch(visibility::hasTeam))
                .filter(project -> stateName == null || stateName.equalsIgnoreCase(project.getStateName()))
                .map(this::toProjectDto)
                .toList();
    }

    public boolean isProjectVisible(UUID hubId, String projectId) {
        return visibility(hubId).isProjectVisible(projectId);
    }

    public List<HubInitiativeDto> listInitiatives(UUID hubId, String status) {
        HubVisibility visibility = visibility(hubId);
        if (visibility.isEmpty()) {
            return List.of();
        }

        Optional<Set<String>> allowed = visibility.allowedInitiativeIds();
        List<SyncedInitiative> candidates = allowed
                .map(ids -> ids.isEmpty() ? List.<SyncedInitiative>of()
                        : initiativeRepository.findByWorkspaceIdAndLinearIdInOrderByNameAsc(workspaceId, ids))
                .orElseGet(() -> initiativeRepository.findByWorkspaceIdOrderByNameAsc(workspaceId));

        return candidates.stream()
                .filter(initiative -> status == null || status.equalsIgnoreCase(initiative.getStatus()))
                .map(this::toInitiativeDto)
                .toList();
    }

    /**
     * Cycles of the hub's teams, newest first. Stats count only issues the hub can see;
     * {@code completed} means the issue's workflow state type is {@code completed}.
     */
    public List<HubCycleDto> listCycles(UUID hubId, String teamId) {
        HubVisibility visibility = visibility(hubId);
        Set<String> teamIds = scopeTeams(visibility, teamId);
        if (teamIds.isEmpty()) {
            return List.of();
        }

        List<SyncedCycle> cycles = cycleRepository.findByWorkspaceIdAndTeamIdInOrderByStartsAtDesc(workspaceId, teamIds);
        if (cycles.isEmpty()) {
            return List.of();
        }

        Map<String, int[]> counters = new HashMap<>();
        for (SyncedIssue issue : issueRepository.findByWorkspaceIdAndTeamIdInOrderByUpdatedAtDesc(workspaceId, teamIds)) {
            JsonNode payload = parse(issue.getPayload());
            String cycleId = UpstreamPayloads.refId(payload, "cycle");
            if (cycleId == null || !isVisible(visibility, issue, payload)) {
                continue;
            }
            int[] counter = counters.computeIfAbsent(cycleId, id -> new int[2]);
            counter[0]++;
            if ("completed".equals(UpstreamPayloads.text(payload.path("state"), "type"))) {
                counter[1]++;
            }
        }

        return cycles.stream()
                .map(cycle -> {
                    int[] counter = counters.get(cycle.getLinearId());
                    return new HubCycleDto(cycle.getLinearId(), cycle.getName(), cycle.getNumber(), cycle.getTeamId(),
                            cycle.getStartsAt(), cycle.getEndsAt(),
                            counter == null ? HubCycleDto.Stats.empty() : new HubCycleDto.Stats(counter[0], counter[1]));
                })
                .toList();
    }

    /**
     * Distinct states and visible labels over the issues the hub can see.
     */
    public HubMetadataDto metadata(UUID hubId, String teamId, String projectId) {
        List<HubIssueDto> issues = listIssues(hubId, new IssueFilter(teamId, projectId, List.of()));
        if (issues.isEmpty()) {
            return HubMetadataDto.empty();
        }

        Map<String, StateDto> states = new LinkedHashMap<>();
        Map<String, LabelDto> labels = new LinkedHashMap<>();
        for (HubIssueDto issue : issues) {
            if (issue.state() != null && issue.state().name() != null) {
                states.putIfAbsent(issue.state().name(), issue.state());
            }
            issue.labels().forEach(label -> labels.putIfAbsent(label.id(), label));
        }
        return new HubMetadataDto(new ArrayList<>(states.values()), new ArrayList<>(labels.values()));
    }

    // ---- helpers ----

    private Set<String> scopeTeams(HubVisibility visibility, String requestedTeamId) {
        if (requestedTeamId == null || requestedTeamId.isBlank()) {
            return visibility.teamIds();
        }
        return visibility.hasTeam(requestedTeamId) ? Set.of(requestedTeamId) : Set.of();
    }

    private SyncedIssue findVisibleIssue(HubVisibility visibility, String issueId) {
        SyncedIssue issue = issueRepository.findByWorkspaceIdAndLinearId(workspaceId, issueId)
                .filter(candidate -> visibility.hasTeam(candidate.getTeamId()))
                .orElseThrow(() -> ResourceNotFoundException.issue(issueId));
        if (!isVisible(visibility, issue, parse(issue.getPayload()))) {
            throw ResourceNotFoundException.issue(issueId);
        }
        return issue;
    }

    private boolean isVisible(HubVisibility visibility, SyncedIssue issue, JsonNode payload) {
        return visibility.isIssueVisible(issue.getTeamId(), issue.getProjectId(), UpstreamPayloads.labelIds(payload));
    }

    private List<HubCommentDto> comments(String issueId) {
        List<HubCommentDto> comments = new ArrayList<>();
        for (SyncedComment comment : commentRepository.findByWorkspaceIdAndIssueLinearIdOrderByCreatedAtAsc(workspaceId, issueId)) {
            JsonNode payload = parse(comment.getPayload());
            comments.add(new HubCommentDto(
                    comment.getLinearId(),
                    UpstreamPayloads.text(payload, "body"),
                    comment.getAuthorName(),
                    comment.getCreatedAt(),
                    comment.getUpdatedAt()));
        }
        return comments;
    }

    private HubIssueDto toIssueDto(HubVisibility visibility, SyncedIssue issue, JsonNode payload) {
        List<LabelDto> labels = new ArrayList<>();
        for (JsonNode label : UpstreamPayloads.labels(payload)) {
            String labelId = UpstreamPayloads.text(label, "id");
            if (labelId != null && visibility.isLabelVisible(issue.getTeamId(), labelId)) {
                labels.add(new LabelDto(labelId, UpstreamPayloads.text(label, "name"), UpstreamPayloads.text(label, "color")));
            }
        }

        JsonNode state = payload.path("state");
        StateDto stateDto = state.isObject()
                ? new StateDto(UpstreamPayloads.text(state, "id"), UpstreamPayloads.text(state, "name"),
                        UpstreamPayloads.text(state, "color"), UpstreamPayloads.text(state, "type"))
                : issue.getStateName() == null ? null : new StateDto(null, issue.getStateName(), null, null);

        return new HubIssueDto(
                issue.getLinearId(),
                issue.getIdentifier(),
                issue.getTitle(),
                UpstreamPayloads.text(payload, "description"),
                stateDto,
                issue.getPriority(),
                UpstreamPayloads.text(payload, "url"),
                UpstreamPayloads.text(payload, "dueDate"),
                issue.getTeamId(),
                issue.getProjectId(),
                labels,
                issue.getCreatedAt(),
                issue.getUpdatedAt());
    }

    private HubProjectDto toProjectDto(SyncedProject project) {
        JsonNode payload = parse(project.getPayload());
        return new HubProjectDto(
                project.getLinearId(),
                project.getName(),
                UpstreamPayloads.text(payload, "description"),
                project.getStateName(),
                List.copyOf(project.getTeamIds()),
                project.getCreatedAt(),
                project.getUpdatedAt());
    }

    private HubInitiativeDto toInitiativeDto(SyncedInitiative initiative) {
        JsonNode payload = parse(initiative.getPayload());
        return new HubInitiativeDto(
                initiative.getLinearId(),
                initiative.getName(),
                UpstreamPayloads.text(payload, "description"),
                initiative.getStatus(),
                initiative.getUpdatedAt());
    }

    private JsonNode parse(String payload) {
        try {
            return objectMapper.readTree(payload == null ? "{}" : payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt mirror payload", e);
        }
    }
}
