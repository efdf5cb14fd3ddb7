package com.feed.shield.gateway.test.service;

import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.core.store.InMemoryStoreBackend;
import com.feed.shield.gateway.core.store.RemoteStoreAdapter;
import com.feed.shield.gateway.core.store.StoreBackend;
import com.feed.shield.gateway.service.analytics.AnalyticsSummary;
import com.feed.shield.gateway.service.analytics.RequestEvent;
import com.feed.shield.gateway.service.analytics.UsageAnalyticsService;
import com.feed.shield.gateway.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UsageAnalyticsServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 1);

    private MutableClock clock;
    private RemoteStoreAdapter store;
    private UsageAnalyticsService analytics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T11:30:00Z");
        store = new RemoteStoreAdapter(List.of(new InMemoryStoreBackend("fs:", clock)), Duration.ofSeconds(1));
        analytics = new UsageAnalyticsService(store, clock, new ShieldProperties());
    }

    private static RequestEvent event(String at, int status, long latency, String apiKey, String ip) {
        return new RequestEvent("/api/market/price/{coinId}", "GET", status, latency, apiKey, ip, Instant.parse(at));
    }

    @Test
    void summarizesCountsUniquesLatencyAndHours() {
        analytics.track(event("2024-05-01T10:05:00Z", 200, 100, "pro_a", "1.1.1.1")).join();
        analytics.track(event("2024-05-01T10:59:59Z", 200, 50, "pro_a", "2.2.2.2")).join();
        analytics.track(event("2024-05-01T11:00:00Z", 429, 0, null, "2.2.2.2")).join();

        AnalyticsSummary s = analytics.summarize(DAY).join();

        assertThat(s.available()).isTrue();
        assertThat(s.date()).isEqualTo("2024-05-01");
        assertThat(s.totalRequests()).isEqualTo(3);
        assertThat(s.dailyRequests()).isEqualTo(3);
        assertThat(s.uniqueApiKeys()).isEqualTo(1);
        assertThat(s.uniqueIps()).isEqualTo(2);
        assertThat(s.averageLatencyMs()).isEqualTo(50);
        assertThat(s.hourly()).hasSize(24);
        assertThat(s.hourly().get(10)).isEqualTo(2L);
        assertThat(s.hourly().get(11)).isEqualTo(1L);
    }

    @Test
    void perEndpointAndStatusCountersAreWritten() {
        analytics.track(event("2024-05-01T10:05:00Z", 429, 3, null, "1.1.1.1")).join();

        assertThat(store.get("analytics:status:429:2024-05-01").join().get()).isEqualTo("1");
        assertThat(store.get("analytics:endpoint:/api/market/price/{coinId}:2024-05-01").join().get()).isEqualTo("1");
    }

    @Test
    void dayBucketsExpireAfterRetentionWhileTheGlobalTotalStays() {
        analytics.track(event("2024-05-01T10:05:00Z", 200, 10, null, "1.1.1.1")).join();

        clock.advance(Duration.ofDays(31));
        AnalyticsSummary s = analytics.summarize(DAY).join();

        assertThat(s.dailyRequests()).isZero();
        assertThat(s.uniqueIps()).isZero();
        assertThat(s.totalRequests()).isEqualTo(1);
    }

    @Test
    void defaultsToTodayInUtc() {
        analytics.track(event("2024-05-01T00:00:01Z", 200, 10, null, null)).join();

        assertThat(analytics.summarize(null).join().dailyRequests()).isEqualTo(1);
    }

    @Test
    void unavailableStoreNeverFailsTrackingAndReportsZeroes() {
        StoreBackend down = mock(StoreBackend.class);
        when(down.name()).thenReturn("redis");
        when(down.isAvailable()).thenReturn(true);
        when(down.execute(anyList())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        UsageAnalyticsService degraded = new UsageAnalyticsService(
                new RemoteStoreAdapter(List.of(down), Duration.ofSeconds(1)), clock, new ShieldProperties());

        degraded.track(event("2024-05-01T10:05:00Z", 200, 10, "k", "1.1.1.1")).join();
        AnalyticsSummary s = degraded.summarize(DAY).join();

        assertThat(s.available()).isFalse();
        assertThat(s.totalRequests()).isZero();
        assertThat(s.hourly()).containsOnly(0L);
    }
}
