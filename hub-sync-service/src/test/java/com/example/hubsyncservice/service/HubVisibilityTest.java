package com.example.hubsyncservice.service;

import com.example.hubsyncservice.cache.TeamMappingView;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class HubVisibilityTest {

    private static final UUID HUB_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Test
    void testIssueVisibility_OwnTeamMappingDecides() {
        HubVisibility visibility = new HubVisibility(List.of(
                mapping("team-a", List.of("proj-1"), List.of(), List.of()),
                mapping("team-b", List.of(), List.of(), List.of("label-secret"))));

        assertThat(visibility.isIssueVisible("team-a", "proj-1", List.of())).isTrue();
        // project allow-list of team-a hides other projects and issues without project
        assertThat(visibility.isIssueVisible("team-a", "proj-2", List.of())).isFalse();
        assertThat(visibility.isIssueVisible("team-a", null, List.of())).isFalse();
        // team-b is unscoped for projects but hides a label
        assertThat(visibility.isIssueVisible("team-b", null, List.of("label-bug"))).isTrue();
        assertThat(visibility.isIssueVisible("team-b", "proj-9", List.of("label-bug", "label-secret"))).isFalse();
        // unmapped team
        assertThat(visibility.isIssueVisible("team-z", "proj-1", List.of())).isFalse();
        assertThat(visibility.isIssueVisible(null, "proj-1", List.of())).isFalse();
    }

    @Test
    void testLabelVisibility_AllowListTrimsAndHiddenWins() {
        HubVisibility visibility = new HubVisibility(List.of(
                mapping("team-a", List.of(), List.of("label-bug", "label-secret"), List.of("label-secret"))));

        assertThat(visibility.isLabelVisible("team-a", "label-bug")).isTrue();
        assertThat(visibility.isLabelVisible("team-a", "label-feature")).isFalse();
        assertThat(visibility.isLabelVisible("team-a", "label-secret")).isFalse();
        assertThat(visibility.isLabelVisible("team-z", "label-bug")).isFalse();
    }

    @Test
    void testProjectUnion_AnyUnscopedMappingOpensAllProjects() {
        HubVisibility scoped = new HubVisibility(List.of(
                mapping("team-a", List.of("proj-1"), List.of(), List.of()),
                mapping("team-b", List.of("proj-2"), List.of(), List.of())));
        HubVisibility open = new HubVisibility(List.of(
                mapping("team-a", List.of("proj-1"), List.of(), List.of()),
                mapping("team-b", List.of(), List.of(), List.of())));

        assertThat(scoped.allowedProjectIds()).contains(Set.of("proj-1", "proj-2"));
        assertThat(scoped.isProjectVisible("proj-2")).isTrue();
        assertThat(scoped.isProjectVisible("proj-3")).isFalse();

        assertThat(open.allowedProjectIds()).isEmpty();
        assertThat(open.isProjectVisible("proj-3")).isTrue();
        assertThat(open.isProjectVisible(null)).isFalse();
    }

    @Test
    void testEmptyHub_SeesNothing() {
        HubVisibility visibility = new HubVisibility(List.of());

        assertThat(visibility.isEmpty()).isTrue();
        assertThat(visibility.teamIds()).isEmpty();
        assertThat(visibility.isProjectVisible("proj-1")).isFalse();
        assertThat(visibility.isInitiativeVisible("init-1")).isFalse();
    }

    @Test
    void testInitiativeUnion() {
        HubVisibility visibility = new HubVisibility(List.of(
                TeamMappingView.builder()
                        .hubId(HUB_ID)
                        .teamId("team-a")
                        .visibleProjectIds(List.of())
                        .visibleInitiativeIds(List.of("init-1"))
                        .visibleLabelIds(List.of())
                        .hiddenLabelIds(List.of())
                        .build()));

        assertThat(visibility.isInitiativeVisible("init-1")).isTrue();
        assertThat(visibility.isInitiativeVisible("init-2")).isFalse();
    }

    static TeamMappingView mapping(String teamId, List<String> projects, List<String> labels, List<String> hidden) {
        return TeamMappingView.builder()
                .mappingId(UUID.randomUUID())
                .hubId(HUB_ID)
                .teamId(teamId)
                .teamName(teamId.toUpperCase())
                .visibleProjectIds(projects)
                .visibleInitiativeIds(List.of())
                .visibleLabelIds(labels)
                .hiddenLabelIds(hidden)
                .build();
    }
}
