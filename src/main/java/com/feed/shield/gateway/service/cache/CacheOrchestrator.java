package com.feed.shield.gateway.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.common.exception.UpstreamFetchFailedException;
import com.feed.shield.gateway.core.cache.CacheEntry;
import com.feed.shield.gateway.core.cache.CacheLookup;
import com.feed.shield.gateway.core.cache.LocalCache;
import com.feed.shield.gateway.core.store.RemoteStoreAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Read-through, stale-while-revalidate cache in front of caller-supplied fetch functions.
 *
 * <p>Lookup order is local cache, shared store, then the fetch function. Fresh values are
 * returned as is. Stale values are returned immediately while one background refresh
 * rewrites both layers. A failed fetch falls back to the last value known for the key as
 * long as it is younger than {@code retentionFactor * ttl}.</p>
 *
 * <p>Per process at most one load (foreground or background) runs per key; concurrent
 * callers missing the same key share its outcome.</p>
 */
@Slf4j
@Service
public class CacheOrchestrator {

    private final LocalCache<String> local;
    private final RemoteStoreAdapter remote;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Executor refreshExecutor;
    private final Duration fetchTimeout;
    private final double retentionFactor;

    private final ConcurrentMap<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    public CacheOrchestrator(LocalCache<String> local,
                             RemoteStoreAdapter remote,
                             ObjectMapper mapper,
                             Clock clock,
                             @Qualifier("refreshExecutor") Executor refreshExecutor,
                             ShieldProperties props) {
        this.local = local;
        this.remote = remote;
        this.mapper = mapper;
        this.clock = clock;
        this.refreshExecutor = refreshExecutor;
        this.fetchTimeout = props.getCache().getFetchTimeout();
        this.retentionFactor = props.getCache().getRetentionFactor();
    }

    public <T> CompletableFuture<T> withCache(String key, CacheTtl ttl, Class<T> type,
                                              Supplier<? extends CompletableFuture<? extends T>> fetch) {
        return withCache(key, ttl.seconds(), type, fetch);
    }

    public <T> CompletableFuture<T> withCache(String key, long ttlSeconds, Class<T> type,
                                              Supplier<? extends CompletableFuture<? extends T>> fetch) {
        return load(key, ttlSeconds, mapper.constructType(type), fetch);
    }

    public <T> CompletableFuture<T> withCache(String key, long ttlSeconds, TypeReference<T> type,
                                              Supplier<? extends CompletableFuture<? extends T>> fetch) {
        return load(key, ttlSeconds, mapper.getTypeFactory().constructType(type), fetch);
    }

    /**
     * Removes the key from both layers.
     *
     * @return true when at least one layer held it
     */
    public CompletableFuture<Boolean> invalidate(String key) {
        boolean localRemoved = local.delete(key);
        return remote.del(key).thenApply(r -> localRemoved || (r.isOk() && r.get() != null && r.get() > 0));
    }

    /**
     * Removes every key of a family (e.g. {@code "news:"}) from both layers.
     */
    public CompletableFuture<PrefixInvalidation> invalidatePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        int localRemoved = local.invalidatePrefix(prefix);
        return remote.deleteByPrefix(prefix).thenApply(r -> {
            if (r.isFailure() && remote.isConfigured()) {
                log.warn("Shared store invalidation of {}* failed: {}", prefix, r.getError());
            }
            long remoteRemoved = r.isOk() && r.get() != null ? r.get() : -1L;
            log.info("Invalidated prefix {}: {} local, {} shared", prefix, localRemoved, remoteRemoved);
            return new PrefixInvalidation(prefix, localRemoved, remoteRemoved);
        });
    }

    public CompletableFuture<CacheIntrospection> introspect() {
        return remote.status().thenApply(s -> new CacheIntrospection(local.stats(), s, inFlight.size()));
    }

    public int sweepLocal() {
        return local.sweep();
    }

    // ---------- internals ----------

    private <T> CompletableFuture<T> load(String key, long ttlSeconds, JavaType type,
                                          Supplier<? extends CompletableFuture<?>> fetch) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("cache key must not be blank");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0, got " + ttlSeconds);
        }
        return resolve(key, ttlSeconds, fetch).thenApply(payload -> decode(key, payload, type));
    }

    private CompletableFuture<String> resolve(String key, long ttl, Supplier<? extends CompletableFuture<?>> fetch) {
        Optional<CacheLookup<String>> hit = local.get(key);
        if (hit.isPresent()) {
            CacheLookup<String> lookup = hit.get();
            if (lookup.stale()) {
                refreshInBackground(key, ttl, fetch);
            }
            return CompletableFuture.completedFuture(lookup.value());
        }

        CompletableFuture<String> promise = new CompletableFuture<>();
        CompletableFuture<String> running = inFlight.putIfAbsent(key, promise);
        if (running != null) {
            return running;
        }
        loadThroughRemote(key, ttl, fetch).whenComplete((loaded, ex) -> {
            inFlight.remove(key, promise);
            if (ex != null) {
                promise.completeExceptionally(unwrap(ex));
                return;
            }
            promise.complete(loaded.payload());
            if (loaded.refresh()) {
                refreshInBackground(key, ttl, fetch);
            }
        });
        return promise;
    }

    private CompletableFuture<Loaded> loadThroughRemote(String key, long ttl, Supplier<? extends CompletableFuture<?>> fetch) {
        return remote.get(key).<Loaded>thenCompose(r -> {
            final long now = clock.millis();
            final long ttlMillis = ttl * 1000L;
            CacheEnvelope candidate = null;
            if (r.isOk() && r.get() != null) {
                CacheEnvelope env = readEnvelope(key, r.get());
                if (env != null) {
                    long age = Math.max(0L, now - env.storedAt());
                    if (age < ttlMillis) {
                        local.put(CacheEntry.of(key, env.payload(), env.storedAt(), ttl));
                        boolean stale = age >= ttlMillis * CacheEntry.STALE_RATIO;
                        return CompletableFuture.completedFuture(new Loaded(env.payload(), stale));
                    }
                    if (age < ttlMillis * retentionFactor) {
                        candidate = env;
                    }
                }
            }
            final CacheEnvelope lastResort = candidate;
            return fetchAndStore(key, ttl, fetch).handle((payload, ex) -> {
                if (ex == null) return new Loaded(payload, false);
                return new Loaded(fallbackOrThrow(key, ex, lastResort), false);
            });
        });
    }

    private CompletableFuture<String> fetchAndStore(String key, long ttl, Supplier<? extends CompletableFuture<?>> fetch) {
        CompletableFuture<?> call;
        try {
            call = fetch.get();
            if (call == null) {
                call = CompletableFuture.failedFuture(new IllegalStateException("fetch returned no future"));
            }
        } catch (RuntimeException ex) {
            call = CompletableFuture.failedFuture(ex);
        }
        return call.orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS).thenApply(value -> {
            if (value == null) {
                throw new IllegalStateException("fetch returned null for " + key);
            }
            String payload = encode(value);
            writeThrough(key, ttl, payload);
            return payload;
        });
    }

    private void writeThrough(String key, long ttl, String payload) {
        final long now = clock.millis();
        local.put(CacheEntry.of(key, payload, now, ttl));
        if (!remote.isConfigured()) return;
        final String envelope;
        try {
            envelope = mapper.writeValueAsString(new CacheEnvelope(now, ttl, payload));
        } catch (JsonProcessingException ex) {
            log.warn("Cannot encode envelope for {}: {}", key, ex.getMessage());
            return;
        }
        long remoteTtl = (long) Math.ceil(ttl * retentionFactor);
        remote.setWithTtl(key, envelope, remoteTtl).thenAccept(r -> {
            if (r.isFailure()) {
                log.debug("Write-through of {} to shared store skipped: {}", key, r.getError());
            }
        });
    }

    private void refreshInBackground(String key, long ttl, Supplier<? extends CompletableFuture<?>> fetch) {
        CompletableFuture<String> promise = new CompletableFuture<>();
        if (inFlight.putIfAbsent(key, promise) != null) {
            return;
        }
        CompletableFuture<String> refresh;
        try {
            refresh = CompletableFuture.supplyAsync(() -> fetchAndStore(key, ttl, fetch), refreshExecutor)
                    .thenCompose(f -> f);
        } catch (RejectedExecutionException ex) {
            log.warn("Background refresh of {} dropped, refresh pool is saturated", key);
            refresh = CompletableFuture.failedFuture(ex);
        } catch (RuntimeException ex) {
            refresh = CompletableFuture.failedFuture(ex);
        }
        refresh.whenComplete((payload, ex) -> {
            inFlight.remove(key, promise);
            if (ex == null) {
                log.debug("Background refresh of {} done", key);
                promise.complete(payload);
                return;
            }
            if (!(unwrap(ex) instanceof RejectedExecutionException)) {
                log.warn("Background refresh of {} failed: {}", key, describe(ex));
            }
            // callers that joined this refresh on a miss still get the retained value if any
            try {
                promise.complete(fallbackOrThrow(key, ex, null));
            } catch (UpstreamFetchFailedException noFallback) {
                promise.completeExceptionally(noFallback);
            }
        });
    }

    private String fallbackOrThrow(String key, Throwable failure, CacheEnvelope remoteCandidate) {
        Throwable cause = unwrap(failure);
        Optional<String> lastKnown = local.lastKnown(key);
        if (lastKnown.isPresent()) {
            log.warn("Fetch for {} failed ({}), serving last known local value", key, describe(cause));
            return lastKnown.get();
        }
        if (remoteCandidate != null) {
            log.warn("Fetch for {} failed ({}), serving last known shared value", key, describe(cause));
            return remoteCandidate.payload();
        }
        String code = cause instanceof TimeoutException
                ? UpstreamFetchFailedException.TIMEOUT_ERROR_CODE
                : UpstreamFetchFailedException.DEFAULT_ERROR_CODE;
        throw new UpstreamFetchFailedException(key, code, "Upstream fetch failed for " + key + ": " + describe(cause), cause);
    }

    private CacheEnvelope readEnvelope(String key, String raw) {
        try {
            CacheEnvelope env = mapper.readValue(raw, CacheEnvelope.class);
            return env.payload() == null ? null : env;
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unreadable shared entry {}: {}", key, ex.getOriginalMessage());
            return null;
        }
    }

    private String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Value is not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    private <T> T decode(String key, String payload, JavaType type) {
        try {
            return mapper.readValue(payload, type);
        } catch (JsonProcessingException ex) {
            local.delete(key);
            throw new UpstreamFetchFailedException(key, "Cached value for " + key + " is unreadable", ex);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String describe(Throwable ex) {
        Throwable t = unwrap(ex);
        if (t instanceof TimeoutException) return "timed out";
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    private record Loaded(String payload, boolean refresh) {
    }
}
