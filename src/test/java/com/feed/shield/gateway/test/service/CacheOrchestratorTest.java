package com.feed.shield.gateway.test.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.common.exception.UpstreamFetchFailedException;
import com.feed.shield.gateway.core.cache.LocalCache;
import com.feed.shield.gateway.core.store.InMemoryStoreBackend;
import com.feed.shield.gateway.core.store.RemoteStoreAdapter;
import com.feed.shield.gateway.core.store.StoreBackend;
import com.feed.shield.gateway.service.cache.CacheIntrospection;
import com.feed.shield.gateway.service.cache.CacheOrchestrator;
import com.feed.shield.gateway.service.cache.PrefixInvalidation;
import com.feed.shield.gateway.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CacheOrchestratorTest {

    record Quote(String id, double price) {
    }

    private MutableClock clock;
    private ObjectMapper mapper;
    private ShieldProperties props;
    private RemoteStoreAdapter shared;
    private final AtomicInteger fetches = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        mapper = new ObjectMapper();
        props = new ShieldProperties();
        shared = new RemoteStoreAdapter(List.of(new InMemoryStoreBackend("fs:", clock)), Duration.ofSeconds(1));
    }

    private CacheOrchestrator worker(RemoteStoreAdapter store) {
        return new CacheOrchestrator(new LocalCache<>(100, 2.0, clock), store, mapper, clock, Runnable::run, props);
    }

    private CompletableFuture<Quote> price(double p) {
        fetches.incrementAndGet();
        return CompletableFuture.completedFuture(new Quote("btc", p));
    }

    private CompletableFuture<Quote> failure() {
        fetches.incrementAndGet();
        return CompletableFuture.failedFuture(new IllegalStateException("upstream 502"));
    }

    @Test
    void coldKeyFetchesOnceWarmKeyNever() {
        CacheOrchestrator cache = worker(shared);

        Quote first = cache.withCache("market:price:btc", 30, Quote.class, () -> price(67000)).join();
        Quote second = cache.withCache("market:price:btc", 30, Quote.class, () -> price(1)).join();

        assertThat(first.price()).isEqualTo(67000);
        assertThat(second).isEqualTo(first);
        assertThat(fetches).hasValue(1);
    }

    @Test
    void staleLocalValueIsServedWhileRefreshRewritesIt() {
        CacheOrchestrator cache = worker(shared);
        cache.withCache("k", 30, Quote.class, () -> price(1)).join();

        clock.advance(Duration.ofSeconds(25));
        Quote served = cache.withCache("k", 30, Quote.class, () -> price(2)).join();

        assertThat(served.price()).isEqualTo(1);
        assertThat(fetches).hasValue(2);
        assertThat(cache.withCache("k", 30, Quote.class, () -> price(3)).join().price()).isEqualTo(2);
        assertThat(fetches).hasValue(2);
    }

    @Test
    void secondWorkerReadsThroughTheSharedStore() {
        CacheOrchestrator a = worker(shared);
        CacheOrchestrator b = worker(shared);
        a.withCache("k", 60, Quote.class, () -> price(10)).join();

        Quote viaShared = b.withCache("k", 60, Quote.class, () -> price(99)).join();

        assertThat(viaShared.price()).isEqualTo(10);
        assertThat(fetches).hasValue(1);
    }

    @Test
    void sharedValueKeepsItsTrueAgeAndRefreshesWhenStale() {
        CacheOrchestrator a = worker(shared);
        CacheOrchestrator b = worker(shared);
        a.withCache("k", 30, Quote.class, () -> price(10)).join();

        clock.advance(Duration.ofSeconds(25));
        Quote served = b.withCache("k", 30, Quote.class, () -> price(11)).join();

        assertThat(served.price()).isEqualTo(10);
        assertThat(fetches).hasValue(2);
        assertThat(b.withCache("k", 30, Quote.class, () -> price(12)).join().price()).isEqualTo(11);
    }

    @Test
    void expiredSharedValueIsNotServedAsFresh() {
        CacheOrchestrator a = worker(shared);
        CacheOrchestrator b = worker(shared);
        a.withCache("k", 30, Quote.class, () -> price(10)).join();

        clock.advance(Duration.ofSeconds(31));
        Quote served = b.withCache("k", 30, Quote.class, () -> price(20)).join();

        assertThat(served.price()).isEqualTo(20);
    }

    @Test
    void failedFetchWithNothingCachedIsTemporarilyUnavailable() {
        CacheOrchestrator cache = worker(shared);

        assertThatThrownBy(() -> cache.withCache("k", 30, Quote.class, this::failure).join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(UpstreamFetchFailedException.class)
                .hasFieldOrPropertyWithValue("errorCode", UpstreamFetchFailedException.DEFAULT_ERROR_CODE);
    }

    @Test
    void failedFetchFallsBackToLastKnownValueWithinTwiceTheTtl() {
        CacheOrchestrator cache = worker(shared);
        cache.withCache("k", 30, Quote.class, () -> price(5)).join();

        clock.advance(Duration.ofSeconds(45));
        Quote served = cache.withCache("k", 30, Quote.class, this::failure).join();

        assertThat(served.price()).isEqualTo(5);
    }

    @Test
    void failedFetchFallsBackToSharedValueOnAnotherWorker() {
        worker(shared).withCache("k", 30, Quote.class, () -> price(5)).join();

        clock.advance(Duration.ofSeconds(45));
        Quote served = worker(shared).withCache("k", 30, Quote.class, this::failure).join();

        assertThat(served.price()).isEqualTo(5);
    }

    @Test
    void noFallbackPastTwiceTheTtl() {
        CacheOrchestrator cache = worker(shared);
        cache.withCache("k", 30, Quote.class, () -> price(5)).join();

        clock.advance(Duration.ofSeconds(61));

        assertThatThrownBy(() -> cache.withCache("k", 30, Quote.class, this::failure).join())
                .hasCauseInstanceOf(UpstreamFetchFailedException.class);
    }

    @Test
    void unavailableStoreDegradesToLocalOnly() {
        StoreBackend down = mock(StoreBackend.class);
        when(down.name()).thenReturn("redis");
        when(down.isAvailable()).thenReturn(true);
        when(down.execute(anyList())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("refused")));
        CacheOrchestrator cache = worker(new RemoteStoreAdapter(List.of(down), Duration.ofSeconds(1)));

        assertThat(cache.withCache("k", 30, Quote.class, () -> price(7)).join().price()).isEqualTo(7);
        assertThat(cache.withCache("k", 30, Quote.class, () -> price(8)).join().price()).isEqualTo(7);
        assertThat(fetches).hasValue(1);
    }

    @Test
    void concurrentMissesShareOneFetch() {
        CacheOrchestrator cache = worker(RemoteStoreAdapter.localOnly());
        CompletableFuture<Quote> upstream = new CompletableFuture<>();

        CompletableFuture<Quote> c1 = cache.withCache("k", 30, Quote.class, () -> {
            fetches.incrementAndGet();
            return upstream;
        });
        CompletableFuture<Quote> c2 = cache.withCache("k", 30, Quote.class, () -> price(0));
        upstream.complete(new Quote("btc", 42));

        assertThat(c1.join().price()).isEqualTo(42);
        assertThat(c2.join().price()).isEqualTo(42);
        assertThat(fetches).hasValue(1);
    }

    @Test
    void slowFetchTimesOut() {
        props.getCache().setFetchTimeout(Duration.ofMillis(50));
        CacheOrchestrator cache = worker(shared);

        assertThatThrownBy(() -> cache.withCache("k", 30, Quote.class, () -> new CompletableFuture<Quote>()).join())
                .cause()
                .isInstanceOf(UpstreamFetchFailedException.class)
                .hasFieldOrPropertyWithValue("errorCode", UpstreamFetchFailedException.TIMEOUT_ERROR_CODE);
    }

    @Test
    void nullFetchResultCountsAsFailure() {
        CacheOrchestrator cache = worker(shared);

        assertThatThrownBy(() -> cache.withCache("k", 30, Quote.class,
                () -> CompletableFuture.completedFuture((Quote) null)).join())
                .hasCauseInstanceOf(UpstreamFetchFailedException.class);
    }

    @Test
    void invalidateDropsBothLayers() {
        CacheOrchestrator cache = worker(shared);
        cache.withCache("k", 30, Quote.class, () -> price(1)).join();

        assertThat(cache.invalidate("k").join()).isTrue();
        assertThat(shared.get("k").join().get()).isNull();
        cache.withCache("k", 30, Quote.class, () -> price(2)).join();
        assertThat(fetches).hasValue(2);
    }

    @Test
    void introspectionListsLocalKeys() {
        CacheOrchestrator cache = worker(shared);
        cache.withCache("a", 30, Quote.class, () -> price(1)).join();

        CacheIntrospection info = cache.introspect().join();

        assertThat(info.local().keys()).containsExactly("a");
        assertThat(info.remote().connected()).isTrue();
        assertThat(info.inFlight()).isZero();
    }

    @Test
    void invalidatePrefixDropsTheFamilyFromBothLayers() {
        CacheOrchestrator cache = worker(shared);
        cache.withCache("news:a", 60, Quote.class, () -> price(1)).join();
        cache.withCache("news:b", 60, Quote.class, () -> price(2)).join();
        cache.withCache("market:price:btc", 60, Quote.class, () -> price(3)).join();

        PrefixInvalidation result = cache.invalidatePrefix("news:").join();

        assertThat(result.localRemoved()).isEqualTo(2);
        assertThat(result.remoteRemoved()).isEqualTo(2L);
        assertThat(shared.get("news:a").join().get()).isNull();
        assertThat(shared.get("market:price:btc").join().get()).isNotNull();
        cache.withCache("news:a", 60, Quote.class, () -> price(4)).join();
        assertThat(fetches).hasValue(4);
    }

    @Test
    void invalidatePrefixWithoutSharedStoreReportsLocalOnly() {
        CacheOrchestrator cache = worker(RemoteStoreAdapter.localOnly());
        cache.withCache("news:a", 60, Quote.class, () -> price(1)).join();

        PrefixInvalidation result = cache.invalidatePrefix("news:").join();

        assertThat(result.localRemoved()).isEqualTo(1);
        assertThat(result.remoteRemoved()).isEqualTo(-1L);
        assertThatThrownBy(() -> cache.invalidatePrefix(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void saturatedRefreshPoolStillServesTheStaleValue() {
        Executor full = task -> {
            throw new RejectedExecutionException("refresh pool full");
        };
        CacheOrchestrator cache = new CacheOrchestrator(new LocalCache<>(100, 2.0, clock), shared, mapper, clock, full, props);
        cache.withCache("k", 30, Quote.class, () -> price(1)).join();

        clock.advance(Duration.ofSeconds(25));
        Quote served = cache.withCache("k", 30, Quote.class, () -> price(2)).join();

        assertThat(served.price()).isEqualTo(1);
        assertThat(fetches).hasValue(1);
        CacheIntrospection view = cache.introspect().join();
        assertThat(view.inFlight()).isZero();
    }
}
