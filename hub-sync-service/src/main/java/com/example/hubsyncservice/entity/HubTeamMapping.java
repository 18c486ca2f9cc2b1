package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Binds one upstream team to a hub together with the per-kind visibility allow-lists.
 *
 * An empty allow-list means "everything of that kind is visible"; a non-empty one is strict.
 * {@code hiddenLabelIds} is a deny-list: issues carrying any of these labels are never shown.
 *
 * A team may be actively mapped to at most one hub. The service layer checks this before
 * every insert or reactivation and the partial unique index in V1 backs it up.
 */
@Entity
@Table(name = "hub_team_mappings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_hub_team_mappings_hub_team",
                        columnNames = {"hub_id", "linear_team_id"})
        },
        indexes = {
                @Index(name = "idx_hub_team_mappings_team", columnList = "linear_team_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HubTeamMapping extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "hub_id", nullable = false)
    private UUID hubId;

    @Column(name = "linear_team_id", nullable = false, length = 100)
    private String linearTeamId;

    @Column(name = "linear_team_name")
    private String linearTeamName;

    @Convert(converter = StringListConverter.class)
    @Column(name = "visible_project_ids", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> visibleProjectIds = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "visible_initiative_ids", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> visibleInitiativeIds = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "visible_label_ids", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> visibleLabelIds = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "hidden_label_ids", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> hiddenLabelIds = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;
}
