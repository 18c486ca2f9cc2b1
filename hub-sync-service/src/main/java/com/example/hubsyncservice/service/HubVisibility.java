package com.example.hubsyncservice.service;

import com.example.hubsyncservice.cache.TeamMappingView;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Visibility rules of one hub, computed from its effective team mappings.
 *
 * Per issue, the mapping of the issue's own team decides: project allow-list (an issue without
 * a project is hidden once the list is non-empty), hidden labels (hide the issue) and label
 * allow-list (trim the labels shown).
 *
 * Hub-wide questions use the union rule: an id is visible when any mapping leaves that kind
 * unscoped, or when it appears in the union of all allow-lists.
 */
public final class HubVisibility {

    private final Map<String, TeamMappingView> byTeam;
    private final List<TeamMappingView> mappings;

    public HubVisibility(List<TeamMappingView> mappings) {
        this.mappings = List.copyOf(mappings);
        this.byTeam = new LinkedHashMap<>();
        mappings.forEach(mapping -> byTeam.putIfAbsent(mapping.getTeamId(), mapping));
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public Set<String> teamIds() {
        return byTeam.keySet();
    }

    public boolean hasTeam(String teamId) {
        return teamId != null && byTeam.containsKey(teamId);
    }

    public Optional<TeamMappingView> mappingFor(String teamId) {
        return Optional.ofNullable(teamId).map(byTeam::get);
    }

    public boolean isIssueVisible(String teamId, String projectId, List<String> labelIds) {
        return mappingFor(teamId)
                .map(mapping -> mapping.isProjectVisible(projectId) && !mapping.hidesAnyOf(labelIds))
                .orElse(false);
    }

    public boolean isLabelVisible(String teamId, String labelId) {
        return mappingFor(teamId).map(mapping -> mapping.isLabelVisible(labelId)).orElse(false);
    }

    /**
     * @return empty when some mapping is unscoped for projects, else the union of allow-lists
     */
    public Optional<Set<String>> allowedProjectIds() {
        return union(TeamMappingView::getVisibleProjectIds);
    }

    public Optional<Set<String>> allowedInitiativeIds() {
        return union(TeamMappingView::getVisibleInitiativeIds);
    }

    public boolean isProjectVisible(String projectId) {
        if (isEmpty() || projectId == null) {
            return false;
        }
        return allowedProjectIds().map(ids -> ids.contains(projectId)).orElse(true);
    }

    public boolean isInitiativeVisible(String initiativeId) {
        if (isEmpty() || initiativeId == null) {
            return false;
        }
        return allowedInitiativeIds().map(ids -> ids.contains(initiativeId)).orElse(true);
    }

    private Optional<Set<String>> union(Function<TeamMappingView, List<String>> field) {
        Set<String> ids = new LinkedHashSet<>();
        for (TeamMappingView mapping : mappings) {
            List<String> allowList = field.apply(mapping);
            if (allowList.isEmpty()) {
                return Optional.empty();
            }
            ids.addAll(allowList);
        }
        return Optional.of(ids);
    }
}
