package com.feed.shield.gateway.service.ratelimit;

import com.feed.shield.gateway.core.store.RemoteStoreAdapter;
import com.feed.shield.gateway.core.store.StoreCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sliding-window limiter over a sorted set per identifier ({@code ratelimit:{identifier}}).
 *
 * <p>One pipelined batch per check: trim attempts older than the window, count the
 * survivors, read the oldest one, record this attempt and refresh the key expiry. The
 * attempt is recorded even when denied, so clients that keep hammering stay limited.
 * The batch is not transactional; concurrent bursts may overshoot slightly.</p>
 *
 * <p>If the shared store does not answer, the per-worker {@link LocalRateLimiter} decides.</p>
 */
@Slf4j
@Service
public class SlidingWindowRateLimiter {

    static final String KEY_PREFIX = "ratelimit:";

    private final RemoteStoreAdapter store;
    private final LocalRateLimiter fallback;
    private final Clock clock;

    public SlidingWindowRateLimiter(RemoteStoreAdapter store, LocalRateLimiter fallback, Clock clock) {
        this.store = store;
        this.fallback = fallback;
        this.clock = clock;
    }

    public CompletableFuture<RateLimitDecision> checkLimit(String identifier, long limit, long windowMs) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be > 0, got " + windowMs);
        }
        if (!store.isConfigured()) {
            return CompletableFuture.completedFuture(fallback.check(identifier, limit, windowMs));
        }

        final long now = clock.millis();
        final String key = KEY_PREFIX + identifier;
        final String member = now + "-" + Long.toString(ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE, 36);
        List<StoreCommand> batch = List.of(
                StoreCommand.zRemoveRangeByScore(key, 0, now - windowMs),
                StoreCommand.zCard(key),
                StoreCommand.zMinScore(key),
                StoreCommand.zAdd(key, now, member),
                StoreCommand.pExpire(key, windowMs));

        return store.pipeline(batch).thenApply(r -> {
            if (r.isFailure()) {
                log.debug("Rate limit for {} decided locally: {}", identifier, r.getError());
                return fallback.check(identifier, limit, windowMs);
            }
            List<Object> replies = r.get();
            long count = (Long) replies.get(1);
            Double oldest = (Double) replies.get(2);
            boolean allowed = count < limit;
            long remaining = Math.max(0L, limit - count - (allowed ? 1 : 0));
            long resetIn = oldest == null
                    ? windowMs
                    : Math.max(0L, Math.min(windowMs, oldest.longValue() + windowMs - now));
            return new RateLimitDecision(null, allowed, limit, remaining, resetIn, now + resetIn, false);
        });
    }
}
