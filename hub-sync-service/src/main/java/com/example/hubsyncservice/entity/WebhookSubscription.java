package com.example.hubsyncservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Upstream webhook registration with its signing secret (AES-GCM encrypted at rest).
 */
@Entity
@Table(name = "webhook_subscriptions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_webhook_subscriptions_webhook_id", columnNames = {"webhook_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookSubscription extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Id assigned by the upstream tracker; echoed as {@code webhookId} in deliveries. */
    @Column(name = "webhook_id", nullable = false, length = 100)
    private String webhookId;

    @Column(name = "encrypted_secret", nullable = false, columnDefinition = "TEXT")
    private String encryptedSecret;

    @Column(name = "url", nullable = false)
    private String url;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;
}
