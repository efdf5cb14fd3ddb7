package com.feed.shield.gateway.test.core;

import com.feed.shield.gateway.common.Result;
import com.feed.shield.gateway.core.store.InMemoryStoreBackend;
import com.feed.shield.gateway.core.store.RemoteStoreAdapter;
import com.feed.shield.gateway.core.store.StoreBackend;
import com.feed.shield.gateway.core.store.StoreStatus;
import com.feed.shield.gateway.test.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RemoteStoreAdapterTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T00:00:00Z");

    private static StoreBackend failing(String name) {
        StoreBackend b = mock(StoreBackend.class);
        when(b.name()).thenReturn(name);
        when(b.isAvailable()).thenReturn(true);
        when(b.execute(anyList())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        return b;
    }

    @Test
    void unconfiguredAdapterFailsEveryCallWithoutThrowing() {
        RemoteStoreAdapter adapter = RemoteStoreAdapter.localOnly();

        Result<String> r = adapter.get("k").join();

        assertThat(adapter.isConfigured()).isFalse();
        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorCode()).isEqualTo(RemoteStoreAdapter.STORE_UNAVAILABLE);
    }

    @Test
    void fallsThroughToTheNextBackend() {
        StoreBackend broken = failing("redis");
        RemoteStoreAdapter adapter = new RemoteStoreAdapter(
                List.of(broken, new InMemoryStoreBackend("fs:", clock)), Duration.ofSeconds(1));

        assertThat(adapter.setWithTtl("k", "v", 60).join().isOk()).isTrue();
        Result<String> r = adapter.get("k").join();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get()).isEqualTo("v");
    }

    @Test
    void everyBackendFailingYieldsStoreUnavailable() {
        RemoteStoreAdapter adapter = new RemoteStoreAdapter(List.of(failing("redis"), failing("rest")),
                Duration.ofSeconds(1));

        Result<Long> r = adapter.incr("n").join();

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("STORE_UNAVAILABLE");
        assertThat(r.getError()).contains("boom");
    }

    @Test
    void synchronousThrowIsContained() {
        StoreBackend b = mock(StoreBackend.class);
        when(b.name()).thenReturn("weird");
        when(b.isAvailable()).thenReturn(true);
        when(b.execute(anyList())).thenThrow(new IllegalArgumentException("bad"));
        RemoteStoreAdapter adapter = new RemoteStoreAdapter(List.of(b), Duration.ofSeconds(1));

        assertThat(adapter.zCard("w").join().getErrorCode()).isEqualTo("STORE_UNAVAILABLE");
    }

    @Test
    void unansweredCallTimesOut() {
        StoreBackend hanging = mock(StoreBackend.class);
        when(hanging.name()).thenReturn("slow");
        when(hanging.isAvailable()).thenReturn(true);
        when(hanging.execute(anyList())).thenReturn(new CompletableFuture<>());
        RemoteStoreAdapter adapter = new RemoteStoreAdapter(List.of(hanging), Duration.ofMillis(50));

        Result<String> r = adapter.get("k").join();

        assertThat(r.getErrorCode()).isEqualTo("STORE_UNAVAILABLE");
        assertThat(r.getError()).isEqualTo("timed out");
    }

    @Test
    void unavailableBackendIsSkippedWithoutIo() {
        StoreBackend down = mock(StoreBackend.class);
        when(down.name()).thenReturn("redis");
        when(down.isAvailable()).thenReturn(false);
        RemoteStoreAdapter adapter = new RemoteStoreAdapter(
                List.of(down, new InMemoryStoreBackend("fs:", clock)), Duration.ofSeconds(1));

        assertThat(adapter.pfAdd("u", "a").join().get()).isTrue();
        verify(down, never()).execute(anyList());
    }

    @Test
    void statusReportsActiveBackendAndKeyCount() {
        InMemoryStoreBackend mem = new InMemoryStoreBackend("fs:", clock);
        RemoteStoreAdapter adapter = new RemoteStoreAdapter(List.of(mem), Duration.ofSeconds(1));
        adapter.setWithTtl("a", "1", 60).join();
        adapter.setWithTtl("b", "2", 60).join();

        StoreStatus s = adapter.status().join();

        assertThat(s.configured()).isTrue();
        assertThat(s.connected()).isTrue();
        assertThat(s.activeBackend()).isEqualTo("in-memory");
        assertThat(s.keyCount()).isEqualTo(2L);
    }

    @Test
    void prefixDeleteFailsOverAndRejectsBlankPrefix() {
        StoreBackend broken = failing("redis");
        when(broken.deleteByPrefix(anyString())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        InMemoryStoreBackend memory = new InMemoryStoreBackend("fs:", clock);
        RemoteStoreAdapter adapter = new RemoteStoreAdapter(List.of(broken, memory), Duration.ofSeconds(1));
        adapter.setWithTtl("news:a", "1", 60).join();
        adapter.setWithTtl("sources:all", "2", 60).join();

        Result<Long> r = adapter.deleteByPrefix("news:").join();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get()).isEqualTo(1L);
        assertThat(adapter.get("sources:all").join().get()).isEqualTo("2");
        assertThat(adapter.deleteByPrefix("").join().getErrorCode()).isEqualTo("ERR-VAL-001");
    }
}
