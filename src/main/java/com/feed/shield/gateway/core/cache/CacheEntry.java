package com.feed.shield.gateway.core.cache;

import java.util.Objects;

/**
 * One immutable cache slot. Overwrites replace the whole entry.
 *
 * @param storedAt          epoch millis when the value was produced
 * @param ttlSeconds        hard expiry, measured from {@code storedAt}
 * @param staleAfterSeconds age from which the value is served as stale; never above the ttl
 */
public record CacheEntry<V>(String key, V value, long storedAt, double ttlSeconds, double staleAfterSeconds) {

    public static final double STALE_RATIO = 0.8;

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0, got " + ttlSeconds);
        }
        if (staleAfterSeconds < 0 || staleAfterSeconds > ttlSeconds) {
            throw new IllegalArgumentException("staleAfterSeconds must be within [0, ttlSeconds]");
        }
    }

    public static <V> CacheEntry<V> of(String key, V value, long storedAt, double ttlSeconds) {
        return new CacheEntry<>(key, value, storedAt, ttlSeconds, ttlSeconds * STALE_RATIO);
    }

    public long ageMillis(long nowMillis) {
        return Math.max(0L, nowMillis - storedAt);
    }

    public boolean isExpired(long nowMillis) {
        return ageMillis(nowMillis) >= ttlSeconds * 1000d;
    }

    public boolean isStale(long nowMillis) {
        return ageMillis(nowMillis) >= staleAfterSeconds * 1000d;
    }

    /**
     * True while the entry may still be handed out as a last-resort fallback.
     */
    public boolean isRetained(long nowMillis, double retentionFactor) {
        return ageMillis(nowMillis) < ttlSeconds * retentionFactor * 1000d;
    }
}
