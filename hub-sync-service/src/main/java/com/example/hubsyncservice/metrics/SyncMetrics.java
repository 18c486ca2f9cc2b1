package com.example.hubsyncservice.metrics;

import com.example.hubsyncservice.entity.SyncRun;
import com.example.hubsyncservice.webhook.WebhookOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - sync_runs_total: sync/reconcile runs by run_type and status
 * - sync_duration_seconds: run duration by run_type
 * - sync_team_failures_total: per-team failures caught by the orchestrators
 * - mirror_rows_upserted_total / mirror_rows_deleted_total: writes by table
 * - webhook_events_total: webhook deliveries by outcome
 * - constraint_violation_count: unique violations surfacing from upserts (expected 0)
 * - parser_warning_count: unparseable upstream timestamps
 * - mapping_cache_reloads_total: team mapping snapshot reloads by result
 *
 * Access metrics: http://localhost:8085/actuator/prometheus
 */
@Component
@Slf4j
public class SyncMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter teamFailureCounter;
    private final Counter constraintViolationCounter;
    private final Counter parserWarningCounter;
    private final Counter cacheReloadSuccessCounter;
    private final Counter cacheReloadFailureCounter;

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.teamFailureCounter = Counter.builder("sync_team_failures_total")
                .description("Per-team failures caught during sync or reconcile")
                .register(meterRegistry);

        this.constraintViolationCounter = Counter.builder("constraint_violation_count")
                .description("Number of database unique constraint violations")
                .register(meterRegistry);

        this.parserWarningCounter = Counter.builder("parser_warning_count")
                .description("Number of timestamp parsing failures")
                .register(meterRegistry);

        this.cacheReloadSuccessCounter = Counter.builder("mapping_cache_reloads_total")
                .description("Team mapping cache reloads")
                .tag("result", "success")
                .register(meterRegistry);

        this.cacheReloadFailureCounter = Counter.builder("mapping_cache_reloads_total")
                .tag("result", "failure")
                .register(meterRegistry);
    }

    public void recordRunFinished(SyncRun.RunType runType, SyncRun.RunStatus status, long durationMs) {
        Counter.builder("sync_runs_total")
                .description("Sync and reconcile runs")
                .tag("run_type", runType.name().toLowerCase())
                .tag("status", status.name().toLowerCase())
                .register(meterRegistry)
                .increment();
        Timer.builder("sync_duration_seconds")
                .description("Duration of sync and reconcile runs")
                .tag("run_type", runType.name().toLowerCase())
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded run: type={}, status={}, duration={}ms", runType, status, durationMs);
    }

    public void recordTeamFailure() {
        teamFailureCounter.increment();
    }

    public void recordRowsUpserted(String table, int rows) {
        Counter.builder("mirror_rows_upserted_total")
                .description("Mirror rows written by upsert")
                .tag("table", table)
                .register(meterRegistry)
                .increment(rows);
    }

    public void recordRowsDeleted(String table, int rows) {
        Counter.builder("mirror_rows_deleted_total")
                .description("Mirror rows deleted by webhook remove events")
                .tag("table", table)
                .register(meterRegistry)
                .increment(rows);
    }

    public void recordWebhookEvent(WebhookOutcome outcome) {
        Counter.builder("webhook_events_total")
                .description("Webhook deliveries by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record UNIQUE constraint violation (SQLState 23505). Indicates an upsert statement that
     * does not target the natural key, or a race on the mapping exclusivity index.
     */
    public void recordConstraintViolation() {
        constraintViolationCounter.increment();
        log.warn("⚠️ Recorded UNIQUE constraint violation (SQLState 23505)");
    }

    /**
     * Log is already done at call site with contextual data.
     */
    public void recordParserWarning() {
        parserWarningCounter.increment();
    }

    public void recordCacheReload(boolean success) {
        if (success) {
            cacheReloadSuccessCounter.increment();
        } else {
            cacheReloadFailureCounter.increment();
        }
    }
}
