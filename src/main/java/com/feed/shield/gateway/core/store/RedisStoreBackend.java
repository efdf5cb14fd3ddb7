package com.feed.shield.gateway.core.store;

import com.feed.shield.gateway.common.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persistent-connection backend using StringRedisTemplate (Lettuce underneath).
 * Keys are prefixed with the provided prefix (e.g., "fs:").
 *
 * <p>The {@code available} flag starts off, is switched on by a successful PING and
 * switched off by any failed call. While off, calls fail fast without touching the
 * socket and a probe retries PING with a bounded exponential backoff.</p>
 */
@Slf4j
public final class RedisStoreBackend implements StoreBackend, AutoCloseable {

    private final StringRedisTemplate redis;
    private final String prefix;
    private final Executor executor;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final ScheduledExecutorService prober;

    private final AtomicBoolean available = new AtomicBoolean(false);
    private final AtomicBoolean probing = new AtomicBoolean(false);
    private final AtomicInteger attempts = new AtomicInteger(0);

    public RedisStoreBackend(StringRedisTemplate redis, String prefix, Executor executor,
                             Duration backoffBase, Duration backoffMax) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
        this.executor = executor;
        this.backoffBase = backoffBase;
        this.backoffMax = backoffMax;
        this.prober = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "redis-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Kicks off the initial connect probe.
     */
    public void start() {
        scheduleProbe(Duration.ZERO);
    }

    @Override
    public void close() {
        prober.shutdownNow();
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public CompletableFuture<List<Object>> execute(List<StoreCommand> commands) {
        if (!available.get()) {
            return CompletableFuture.failedFuture(new StoreUnavailableException("redis connection is down"));
        }
        return CompletableFuture.supplyAsync(() -> runPipeline(commands), executor)
                .whenComplete((r, ex) -> {
                    if (ex != null) onFailure(ex);
                });
    }

    @Override
    public CompletableFuture<Long> keyCount() {
        if (!available.get()) {
            return CompletableFuture.failedFuture(new StoreUnavailableException("redis connection is down"));
        }
        return CompletableFuture.supplyAsync(
                        () -> redis.execute((RedisCallback<Long>) c -> c.serverCommands().dbSize()), executor)
                .whenComplete((r, ex) -> {
                    if (ex != null) onFailure(ex);
                });
    }

    @Override
    public CompletableFuture<Long> deleteByPrefix(String keyPrefix) {
        if (!available.get()) {
            return CompletableFuture.failedFuture(new StoreUnavailableException("redis connection is down"));
        }
        return CompletableFuture.supplyAsync(() -> {
                    Set<String> keys = redis.keys(StoreCommand.prefixPattern(prefix + keyPrefix));
                    if (keys == null || keys.isEmpty()) return 0L;
                    Long n = redis.delete(keys);
                    return n == null ? 0L : n;
                }, executor)
                .whenComplete((r, ex) -> {
                    if (ex != null) onFailure(ex);
                });
    }

    private List<Object> runPipeline(List<StoreCommand> commands) {
        List<Object> raw = redis.executePipelined((RedisCallback<Object>) connection -> {
            for (StoreCommand c : commands) {
                send(connection, c);
            }
            return null;
        });
        if (raw.size() != commands.size()) {
            throw new StoreUnavailableException("redis pipeline returned " + raw.size()
                    + " replies for " + commands.size() + " commands");
        }
        List<Object> replies = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            replies.add(StoreReplies.normalize(commands.get(i).op(), raw.get(i)));
        }
        return replies;
    }

    private void send(RedisConnection connection, StoreCommand c) {
        final byte[] key = bytes(prefix + c.key());
        switch (c.op()) {
            case GET -> connection.stringCommands().get(key);
            case SETEX -> connection.stringCommands().setEx(key, c.longArg(0), bytes(c.arg(1)));
            case DEL -> connection.keyCommands().del(key);
            case INCR -> connection.stringCommands().incr(key);
            case INCRBY -> connection.stringCommands().incrBy(key, c.longArg(0));
            case EXPIRE -> connection.keyCommands().expire(key, c.longArg(0));
            case PEXPIRE -> connection.keyCommands().pExpire(key, c.longArg(0));
            case ZADD -> connection.zSetCommands().zAdd(key, c.doubleArg(0), bytes(c.arg(1)));
            case ZCARD -> connection.zSetCommands().zCard(key);
            case ZREMRANGEBYSCORE -> connection.zSetCommands().zRemRangeByScore(key, c.doubleArg(0), c.doubleArg(1));
            case ZMINSCORE -> connection.zSetCommands().zRangeWithScores(key, 0, 0);
            case PFADD -> {
                byte[][] members = new byte[c.args().size()][];
                for (int i = 0; i < members.length; i++) {
                    members[i] = bytes(c.arg(i));
                }
                connection.hyperLogLogCommands().pfAdd(key, members);
            }
            case PFCOUNT -> connection.hyperLogLogCommands().pfCount(key);
            default -> throw new IllegalArgumentException("Unsupported op " + c.op());
        }
    }

    private void onFailure(Throwable ex) {
        if (available.compareAndSet(true, false)) {
            log.warn("Redis marked unavailable: {}", ex.toString());
            attempts.set(0);
            scheduleProbe(backoffBase);
        }
    }

    private void scheduleProbe(Duration delay) {
        if (!probing.compareAndSet(false, true)) return;
        try {
            prober.schedule(this::probe, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException ex) {
            // scheduler already shut down
            probing.set(false);
        }
    }

    private void probe() {
        probing.set(false);
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            if (pong == null) {
                throw new StoreUnavailableException("empty PING reply");
            }
            attempts.set(0);
            if (available.compareAndSet(false, true)) {
                log.info("Redis connected");
            }
        } catch (Exception ex) {
            int n = attempts.incrementAndGet();
            Duration next = nextDelay(n);
            log.warn("Redis connect attempt {} failed ({}), next try in {} ms", n, ex.toString(), next.toMillis());
            scheduleProbe(next);
        }
    }

    Duration nextDelay(int attempt) {
        long base = backoffBase.toMillis();
        long max = backoffMax.toMillis();
        int shift = Math.min(Math.max(attempt - 1, 0), 20);
        return Duration.ofMillis(Math.min(max, base << shift));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
