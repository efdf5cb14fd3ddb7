package com.feed.shield.gateway.service.cache;

/**
 * Outcome of a prefix invalidation.
 *
 * @param remoteRemoved -1 when the shared store could not be reached
 */
public record PrefixInvalidation(String prefix, int localRemoved, long remoteRemoved) {
}
