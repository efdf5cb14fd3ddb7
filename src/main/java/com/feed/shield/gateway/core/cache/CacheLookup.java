package com.feed.shield.gateway.core.cache;

/**
 * Result of a successful local lookup. {@code stale} signals the caller to refresh.
 */
public record CacheLookup<V>(V value, boolean stale, long ageMillis) {
}
