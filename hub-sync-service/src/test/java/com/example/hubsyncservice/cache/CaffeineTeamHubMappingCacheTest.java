package com.example.hubsyncservice.cache;

import com.example.hubsyncservice.entity.HubTeamMapping;
import com.example.hubsyncservice.metrics.SyncMetrics;
import com.example.hubsyncservice.repository.HubTeamMappingRepository;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CaffeineTeamHubMappingCacheTest {

    private static final UUID HUB_ALPHA = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID HUB_BETA = UUID.fromString("00000000-0000-0000-0000-00000000000b");

    @Mock
    private HubTeamMappingRepository mappingRepository;

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    private CaffeineTeamHubMappingCache cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineTeamHubMappingCache(mappingRepository,
                new SyncMetrics(new SimpleMeterRegistry()), Duration.ofSeconds(60), ticker);
    }

    @Test
    void testLookups_ReflectEffectiveMappings() {
        when(mappingRepository.findAllEffective()).thenReturn(List.of(
                mapping(HUB_ALPHA, "team-a"),
                mapping(HUB_ALPHA, "team-b"),
                mapping(HUB_BETA, "team-c")));

        assertThat(cache.isTeamTracked("team-a")).isTrue();
        assertThat(cache.isTeamTracked("team-z")).isFalse();
        assertThat(cache.isTeamTracked(null)).isFalse();
        assertThat(cache.hubsForTeam("team-c")).containsExactly(HUB_BETA);
        assertThat(cache.mappingsForHub(HUB_ALPHA))
                .extracting(TeamMappingView::getTeamId)
                .containsExactlyInAnyOrder("team-a", "team-b");
        assertThat(cache.mappingsForHub(UUID.randomUUID())).isEmpty();
        assertThat(cache.trackedTeamIds()).containsExactlyInAnyOrder("team-a", "team-b", "team-c");

        // one snapshot serves every lookup
        verify(mappingRepository, times(1)).findAllEffective();
    }

    @Test
    void testSnapshotReloadsAfterTtl() {
        when(mappingRepository.findAllEffective())
                .thenReturn(List.of(mapping(HUB_ALPHA, "team-a")))
                .thenReturn(List.of(mapping(HUB_ALPHA, "team-b")));

        assertThat(cache.isTeamTracked("team-a")).isTrue();

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(30));
        assertThat(cache.isTeamTracked("team-a")).isTrue();

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(31));
        assertThat(cache.isTeamTracked("team-a")).isFalse();
        assertThat(cache.isTeamTracked("team-b")).isTrue();
    }

    @Test
    void testInvalidate_NextLookupSeesNewState() {
        when(mappingRepository.findAllEffective())
                .thenReturn(List.of(mapping(HUB_ALPHA, "team-a")))
                .thenReturn(List.of());

        assertThat(cache.isTeamTracked("team-a")).isTrue();

        cache.invalidate();

        assertThat(cache.isTeamTracked("team-a")).isFalse();
        verify(mappingRepository, times(2)).findAllEffective();
    }

    @Test
    void testReloadFailureAfterTtl_ServesPreviousSnapshot() {
        when(mappingRepository.findAllEffective())
                .thenReturn(List.of(mapping(HUB_ALPHA, "team-a")))
                .thenThrow(new IllegalStateException("database down"));

        assertThat(cache.isTeamTracked("team-a")).isTrue();

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(61));

        assertThat(cache.isTeamTracked("team-a")).isTrue();
    }

    @Test
    void testReloadFailureWithoutSnapshot_Propagates() {
        when(mappingRepository.findAllEffective()).thenThrow(new IllegalStateException("database down"));

        assertThatThrownBy(() -> cache.isTeamTracked("team-a"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("database down");
    }

    @Test
    void testReloadFailureAfterInvalidate_Propagates() {
        when(mappingRepository.findAllEffective())
                .thenReturn(List.of(mapping(HUB_ALPHA, "team-a")))
                .thenThrow(new IllegalStateException("database down"));

        assertThat(cache.isTeamTracked("team-a")).isTrue();
        cache.invalidate();

        assertThatThrownBy(() -> cache.isTeamTracked("team-a"))
                .isInstanceOf(IllegalStateException.class);
    }

    private static HubTeamMapping mapping(UUID hubId, String teamId) {
        return HubTeamMapping.builder()
                .id(UUID.randomUUID())
                .hubId(hubId)
                .linearTeamId(teamId)
                .linearTeamName(teamId.toUpperCase())
                .build();
    }
}
