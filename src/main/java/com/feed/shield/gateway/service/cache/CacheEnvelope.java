package com.feed.shield.gateway.service.cache;

/**
 * What the shared store holds for a cached key: the serialized value plus enough metadata for
 * any worker to compute its true age.
 *
 * @param storedAt epoch millis when the value was fetched
 * @param payload  JSON text of the value
 */
public record CacheEnvelope(long storedAt, long ttlSeconds, String payload) {
}
