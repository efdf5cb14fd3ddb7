package com.feed.shield.gateway.core.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded, TTL-aware in-process cache. Per worker only, never authoritative.
 *
 * <p>Reads are lock-free. Writes are serialized so the capacity bound holds under
 * concurrent inserts. Expired entries stay around until {@code retentionFactor * ttl}
 * so they can be served as a last resort through {@link #lastKnown(String)}; plain
 * {@link #get(String)} never returns them.</p>
 */
@Slf4j
public class LocalCache<V> {

    private final ConcurrentMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final int maxSize;
    private final double retentionFactor;
    private final Clock clock;

    public LocalCache(int maxSize, double retentionFactor, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, got " + maxSize);
        }
        if (retentionFactor < 1.0) {
            throw new IllegalArgumentException("retentionFactor must be >= 1.0, got " + retentionFactor);
        }
        this.maxSize = maxSize;
        this.retentionFactor = retentionFactor;
        this.clock = clock;
    }

    public Optional<CacheLookup<V>> get(String key) {
        if (key == null) return Optional.empty();
        final CacheEntry<V> e = entries.get(key);
        if (e == null) return Optional.empty();
        final long now = clock.millis();
        if (e.isExpired(now)) {
            if (!e.isRetained(now, retentionFactor)) {
                entries.remove(key, e);
            }
            return Optional.empty();
        }
        return Optional.of(new CacheLookup<>(e.value(), e.isStale(now), e.ageMillis(now)));
    }

    /**
     * Value of an expired-but-retained entry (or a live one), for fallback after a failed refresh.
     */
    public Optional<V> lastKnown(String key) {
        if (key == null) return Optional.empty();
        final CacheEntry<V> e = entries.get(key);
        if (e == null || !e.isRetained(clock.millis(), retentionFactor)) {
            return Optional.empty();
        }
        return Optional.of(e.value());
    }

    public void set(String key, V value, double ttlSeconds) {
        put(CacheEntry.of(key, value, clock.millis(), ttlSeconds));
    }

    /**
     * Inserts a complete entry, keeping its original {@code storedAt} (remote backfill).
     */
    public synchronized void put(CacheEntry<V> entry) {
        if (!entries.containsKey(entry.key()) && entries.size() >= maxSize) {
            evictOldest();
        }
        entries.put(entry.key(), entry);
    }

    public boolean delete(String key) {
        return key != null && entries.remove(key) != null;
    }

    public boolean has(String key) {
        return get(key).isPresent();
    }

    public int invalidatePrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) return 0;
        int before = entries.size();
        entries.keySet().removeIf(k -> k.startsWith(prefix));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    public LocalCacheStats stats() {
        ArrayList<String> keys = new ArrayList<>(entries.keySet());
        Collections.sort(keys);
        return new LocalCacheStats(entries.size(), maxSize, keys);
    }

    /**
     * Drops every entry past its retention horizon.
     *
     * @return number of purged entries
     */
    public int sweep() {
        final long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            if (!e.getValue().isRetained(now, retentionFactor) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Local cache sweep purged {} entries, {} left", removed, entries.size());
        }
        return removed;
    }

    private void evictOldest() {
        CacheEntry<V> oldest = null;
        for (CacheEntry<V> e : entries.values()) {
            if (oldest == null || e.storedAt() < oldest.storedAt()) {
                oldest = e;
            }
        }
        if (oldest != null) {
            entries.remove(oldest.key(), oldest);
        }
    }
}
