package com.example.hubsyncservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA configuration.
 *
 * Enables JPA auditing for created_at/updated_at on configuration tables. Mirror tables are
 * written with native upserts and carry upstream timestamps instead.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
