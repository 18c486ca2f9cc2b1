package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.WebhookSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WebhookSubscriptionRepository extends JpaRepository<WebhookSubscription, Long> {

    List<WebhookSubscription> findByActiveTrueOrderByIdAsc();

    Optional<WebhookSubscription> findByWebhookIdAndActiveTrue(String webhookId);
}
