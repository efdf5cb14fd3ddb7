package com.feed.shield.gateway.service.ratelimit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one admission check.
 *
 * @param tier        tier the numbers belong to (null for a bare window check)
 * @param resetInMs   time until the window frees a slot
 * @param resetAtMs   epoch millis of that moment
 * @param degraded    true when decided by the per-worker fallback
 */
public record RateLimitDecision(String tier, boolean allowed, long limit, long remaining,
                                long resetInMs, long resetAtMs, boolean degraded) {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    public RateLimitDecision withTier(String tierName) {
        return new RateLimitDecision(tierName, allowed, limit, remaining, resetInMs, resetAtMs, degraded);
    }

    public long retryAfterSeconds() {
        return allowed ? 0L : Math.max(1L, ceilDiv(resetInMs, 1000L));
    }

    /**
     * Standard response headers; {@code Retry-After} only when denied.
     */
    public Map<String, String> headers() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(HEADER_LIMIT, Long.toString(limit));
        h.put(HEADER_REMAINING, Long.toString(remaining));
        h.put(HEADER_RESET, Long.toString(ceilDiv(resetAtMs, 1000L)));
        if (!allowed) {
            h.put(HEADER_RETRY_AFTER, Long.toString(retryAfterSeconds()));
        }
        return h;
    }

    private static long ceilDiv(long x, long y) {
        return -Math.floorDiv(-x, y);
    }
}
