package com.example.hubsyncservice.service;

import com.example.hubsyncservice.dto.SyncCounts;
import com.example.hubsyncservice.entity.SyncRun;
import com.example.hubsyncservice.metrics.SyncMetrics;
import com.example.hubsyncservice.repository.SyncRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Bookkeeping for {@link SyncRun} rows. Each method is one short transaction; callers keep
 * upstream calls outside of them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncRunService {

    private static final int MAX_HISTORY = 100;

    private final SyncRunRepository syncRunRepository;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    @Transactional
    public SyncRun startRun(UUID hubId, SyncRun.RunType runType, SyncRun.RunTrigger trigger, String correlationId) {
        SyncRun run = SyncRun.builder()
                .hubId(hubId)
                .runType(runType)
                .trigger(trigger)
                .build();
        run.markAsStarted(correlationId, clock.instant());

        SyncRun saved = syncRunRepository.save(run);
        log.debug("Created sync run id={} hubId={} type={} trigger={}", saved.getId(), hubId, runType, trigger);
        return saved;
    }

    @Transactional
    public SyncRun finishRun(Long runId, SyncCounts counts) {
        SyncRun run = load(runId);
        run.markAsFinished(counts, clock.instant());
        SyncRun saved = syncRunRepository.save(run);
        syncMetrics.recordRunFinished(saved.getRunType(), saved.getStatus(), saved.getDurationMs());

        if (saved.getStatus() == SyncRun.RunStatus.COMPLETED) {
            log.info("✅ Sync run id={} completed in {}ms", runId, saved.getDurationMs());
        } else {
            log.warn("⚠️ Sync run id={} finished with {} error(s) in {}ms", runId, counts.getErrors(), saved.getDurationMs());
        }
        return saved;
    }

    @Transactional
    public SyncRun failRun(Long runId, String errorMessage) {
        SyncRun run = load(runId);
        run.markAsFailed(errorMessage, clock.instant());
        SyncRun saved = syncRunRepository.save(run);
        syncMetrics.recordRunFinished(saved.getRunType(), saved.getStatus(), saved.getDurationMs());
        log.error("❌ Sync run id={} failed: {}", runId, errorMessage);
        return saved;
    }

    /**
     * Latest runs, newest first; all runs when {@code hubId} is null.
     */
    @Transactional(readOnly = true)
    public List<SyncRun> recentRuns(UUID hubId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_HISTORY)));
        return hubId == null
                ? syncRunRepository.findAllByOrderByStartedAtDesc(page)
                : syncRunRepository.findByHubIdOrderByStartedAtDesc(hubId, page);
    }

    private SyncRun load(Long runId) {
        return syncRunRepository.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("SyncRun not found: " + runId));
    }
}
