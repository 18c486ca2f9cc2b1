package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Encrypted key/value secret store for the workspace (upstream API token).
 */
@Entity
@Table(name = "workspace_settings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_workspace_settings_key", columnNames = {"workspace_id", "setting_key"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkspaceSetting extends BaseEntity {

    public static final String LINEAR_API_TOKEN = "linear_api_token";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workspace_id", nullable = false, length = 100)
    private String workspaceId;

    @Column(name = "setting_key", nullable = false, length = 100)
    private String key;

    @Column(name = "encrypted_value", nullable = false, columnDefinition = "TEXT")
    private String encryptedValue;
}
