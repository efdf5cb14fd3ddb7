package com.feed.shield.gateway.service.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-worker fixed-window counter used while the shared store is unreachable.
 * Limits are only approximate across the fleet in that mode.
 */
@Slf4j
@Component
public class LocalRateLimiter {

    private record Window(long count, long resetAt) {
    }

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public RateLimitDecision check(String identifier, long limit, long windowMs) {
        final long now = clock.millis();
        Window w = windows.compute(identifier, (k, cur) -> {
            if (cur == null || now > cur.resetAt()) {
                return new Window(1L, now + windowMs);
            }
            return new Window(cur.count() + 1, cur.resetAt());
        });
        boolean allowed = w.count() <= limit;
        long remaining = Math.max(0L, limit - w.count());
        long resetIn = Math.max(0L, w.resetAt() - now);
        return new RateLimitDecision(null, allowed, limit, remaining, resetIn, w.resetAt(), true);
    }

    /**
     * Drops windows that already ended.
     *
     * @return number of dropped identifiers
     */
    public int purgeExpired() {
        final long now = clock.millis();
        int before = windows.size();
        windows.entrySet().removeIf(e -> now > e.getValue().resetAt());
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("Fallback limiter purged {} windows", removed);
        }
        return removed;
    }

    public int size() {
        return windows.size();
    }
}
