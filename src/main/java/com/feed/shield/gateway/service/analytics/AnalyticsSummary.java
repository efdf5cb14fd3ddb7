package com.feed.shield.gateway.service.analytics;

import java.util.Arrays;
import java.util.List;

/**
 * Counters for one UTC day.
 *
 * @param hourly    24 request counts, index = UTC hour
 * @param available false when the shared store did not answer; every number is then zero
 */
public record AnalyticsSummary(String date, long totalRequests, long dailyRequests, long uniqueApiKeys,
                               long uniqueIps, long averageLatencyMs, List<Long> hourly, boolean available) {

    public static AnalyticsSummary empty(String date) {
        return new AnalyticsSummary(date, 0, 0, 0, 0, 0, zeros(), false);
    }

    static List<Long> zeros() {
        Long[] z = new Long[24];
        Arrays.fill(z, 0L);
        return List.of(z);
    }
}
