package com.feed.shield.gateway.service.analytics;

import java.time.Instant;

/**
 * One completed client request.
 *
 * @param endpoint route pattern (not the raw path) so the per-endpoint key space stays bounded
 */
public record RequestEvent(String endpoint, String method, int statusCode, long latencyMs,
                           String apiKey, String ip, Instant timestamp) {
}
