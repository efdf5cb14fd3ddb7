package com.feed.shield.gateway.core.store;

import com.feed.shield.gateway.common.Result;
import com.feed.shield.gateway.common.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Uniform access to the shared store over an ordered list of {@link StoreBackend}s.
 *
 * <p>Every call tries the backends in order and settles on the first one that answers.
 * Nothing is ever thrown to the caller: exceptions, error replies and timeouts all end up as
 * a failed {@link Result} carrying {@link #STORE_UNAVAILABLE}. With no backend configured every
 * call fails that way immediately, which consumers treat as "local only".</p>
 */
@Slf4j
public class RemoteStoreAdapter {

    public static final String STORE_UNAVAILABLE = StoreUnavailableException.DEFAULT_ERROR_CODE;

    private final List<StoreBackend> backends;
    private final Duration timeout;
    private final AtomicReference<String> lastServed = new AtomicReference<>();

    public RemoteStoreAdapter(List<StoreBackend> backends, Duration timeout) {
        this.backends = backends == null ? List.of() : List.copyOf(backends);
        this.timeout = timeout == null ? Duration.ofSeconds(2) : timeout;
    }

    public static RemoteStoreAdapter localOnly() {
        return new RemoteStoreAdapter(List.of(), Duration.ofSeconds(2));
    }

    public boolean isConfigured() {
        return !backends.isEmpty();
    }

    public boolean isAvailable() {
        for (StoreBackend b : backends) {
            if (b.isAvailable()) return true;
        }
        return false;
    }

    public List<String> backendNames() {
        return backends.stream().map(StoreBackend::name).toList();
    }

    // ---------- single-command operations ----------

    public CompletableFuture<Result<String>> get(String key) {
        return single(StoreCommand.get(key), String.class);
    }

    public CompletableFuture<Result<Boolean>> setWithTtl(String key, String value, long ttlSeconds) {
        return single(StoreCommand.setEx(key, Math.max(1L, ttlSeconds), value), Boolean.class);
    }

    public CompletableFuture<Result<Long>> del(String key) {
        return single(StoreCommand.del(key), Long.class);
    }

    public CompletableFuture<Result<Long>> incr(String key) {
        return single(StoreCommand.incr(key), Long.class);
    }

    public CompletableFuture<Result<Long>> incrBy(String key, long delta) {
        return single(StoreCommand.incrBy(key, delta), Long.class);
    }

    public CompletableFuture<Result<Boolean>> expire(String key, long ttlSeconds) {
        return single(StoreCommand.expire(key, ttlSeconds), Boolean.class);
    }

    public CompletableFuture<Result<Boolean>> pExpire(String key, long ttlMillis) {
        return single(StoreCommand.pExpire(key, ttlMillis), Boolean.class);
    }

    public CompletableFuture<Result<Boolean>> zAdd(String key, double score, String member) {
        return single(StoreCommand.zAdd(key, score, member), Boolean.class);
    }

    public CompletableFuture<Result<Long>> zCard(String key) {
        return single(StoreCommand.zCard(key), Long.class);
    }

    public CompletableFuture<Result<Long>> zRemoveRangeByScore(String key, double min, double max) {
        return single(StoreCommand.zRemoveRangeByScore(key, min, max), Long.class);
    }

    /**
     * Score of the lowest-ranked member; ok(null) when the set is empty or missing.
     */
    public CompletableFuture<Result<Double>> zMinScore(String key) {
        return single(StoreCommand.zMinScore(key), Double.class);
    }

    public CompletableFuture<Result<Boolean>> pfAdd(String key, String... members) {
        if (members == null || members.length == 0) {
            return CompletableFuture.completedFuture(Result.fail("ERR-VAL-001", "pfAdd needs at least one member"));
        }
        return single(StoreCommand.pfAdd(key, members), Boolean.class);
    }

    public CompletableFuture<Result<Long>> pfCount(String key) {
        return single(StoreCommand.pfCount(key), Long.class);
    }

    // ---------- batch ----------

    /**
     * Sends all commands in one round trip on the first backend that answers.
     * Replies are normalized per {@link StoreOp.Reply} and come back in command order.
     */
    public CompletableFuture<Result<List<Object>>> pipeline(List<StoreCommand> commands) {
        if (commands == null || commands.isEmpty()) {
            return CompletableFuture.completedFuture(Result.ok(List.of()));
        }
        if (backends.isEmpty()) {
            return CompletableFuture.completedFuture(Result.fail(STORE_UNAVAILABLE, "no shared store configured"));
        }
        return attempt(commands.size() + " commands", b -> b.execute(commands), 0, null);
    }

    /**
     * Deletes every key starting with {@code keyPrefix} on the first backend that answers.
     */
    public CompletableFuture<Result<Long>> deleteByPrefix(String keyPrefix) {
        if (keyPrefix == null || keyPrefix.isBlank()) {
            return CompletableFuture.completedFuture(Result.fail("ERR-VAL-001", "prefix must not be blank"));
        }
        if (backends.isEmpty()) {
            return CompletableFuture.completedFuture(Result.fail(STORE_UNAVAILABLE, "no shared store configured"));
        }
        return attempt("delete prefix " + keyPrefix, b -> b.deleteByPrefix(keyPrefix), 0, null);
    }

    /**
     * Connectivity snapshot; never fails.
     */
    public CompletableFuture<StoreStatus> status() {
        StoreBackend active = firstAvailable(0);
        if (active == null) {
            return CompletableFuture.completedFuture(
                    new StoreStatus(isConfigured(), false, null, backendNames(), -1L));
        }
        CompletableFuture<Long> count;
        try {
            count = active.keyCount().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException ex) {
            count = CompletableFuture.failedFuture(ex);
        }
        return count.handle((n, ex) -> {
            if (ex != null) {
                log.warn("Store key count failed on {}: {}", active.name(), describe(ex));
                return new StoreStatus(true, false, active.name(), backendNames(), -1L);
            }
            return new StoreStatus(true, true, active.name(), backendNames(), n == null ? 0L : n);
        });
    }

    // ---------- internals ----------

    private <T> CompletableFuture<Result<T>> single(StoreCommand command, Class<T> type) {
        return pipeline(List.of(command)).thenApply(r -> {
            if (r.isFailure()) return Result.<T>fail(r.getErrorCode(), r.getError());
            Object reply = r.get().get(0);
            return Result.ok(type.cast(reply));
        });
    }

    private <R> CompletableFuture<Result<R>> attempt(String what, Function<StoreBackend, CompletableFuture<R>> call,
                                                     int from, Throwable last) {
        int index = indexOfAvailable(from);
        if (index < 0) {
            String msg = last == null ? "no store backend available" : describe(last);
            return CompletableFuture.completedFuture(Result.fail(STORE_UNAVAILABLE, msg));
        }
        StoreBackend backend = backends.get(index);
        CompletableFuture<R> running;
        try {
            running = call.apply(backend).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException ex) {
            running = CompletableFuture.failedFuture(ex);
        }
        return running.<CompletableFuture<Result<R>>>handle((reply, ex) -> {
            if (ex == null) {
                String prev = lastServed.getAndSet(backend.name());
                if (prev != null && !prev.equals(backend.name())) {
                    log.info("Shared store now served by {}", backend.name());
                }
                return CompletableFuture.completedFuture(Result.<R>ok(reply));
            }
            log.warn("Store backend {} failed ({}): {}", backend.name(), what, describe(ex));
            return attempt(what, call, index + 1, ex);
        }).thenCompose(f -> f);
    }

    private int indexOfAvailable(int from) {
        for (int i = from; i < backends.size(); i++) {
            if (backends.get(i).isAvailable()) return i;
        }
        return -1;
    }

    private StoreBackend firstAvailable(int from) {
        int i = indexOfAvailable(from);
        return i < 0 ? null : backends.get(i);
    }

    private static String describe(Throwable ex) {
        Throwable t = ex;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof TimeoutException) return "timed out";
        return t.getMessage() == null ? t.toString() : t.getMessage();
    }
}
