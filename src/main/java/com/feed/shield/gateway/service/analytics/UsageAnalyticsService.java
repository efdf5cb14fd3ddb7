package com.feed.shield.gateway.service.analytics;

import com.feed.shield.gateway.common.Result;
import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.core.store.RemoteStoreAdapter;
import com.feed.shield.gateway.core.store.StoreCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Best-effort request counters in the shared store. Day and hour buckets are UTC.
 * Nothing is kept when the store is down: counts are advisory.
 */
@Slf4j
@Service
public class UsageAnalyticsService {

    static final String TOTAL = "analytics:requests:total";
    private static final DateTimeFormatter HOUR = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH").withZone(ZoneOffset.UTC);

    private final RemoteStoreAdapter store;
    private final Clock clock;
    private final boolean enabled;
    private final long retentionSeconds;

    public UsageAnalyticsService(RemoteStoreAdapter store, Clock clock, ShieldProperties props) {
        this.store = store;
        this.clock = clock;
        this.enabled = props.getAnalytics().isEnabled();
        this.retentionSeconds = props.getAnalytics().getRetentionDays() * 24L * 60 * 60;
    }

    /**
     * Records one request. The returned future always completes normally.
     */
    public CompletableFuture<Void> track(RequestEvent event) {
        if (!enabled || event == null || !store.isConfigured()) {
            return CompletableFuture.completedFuture(null);
        }
        List<StoreCommand> batch;
        try {
            batch = commandsFor(event);
        } catch (RuntimeException ex) {
            log.warn("Analytics event dropped: {}", ex.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return store.pipeline(batch).handle((r, ex) -> {
            if (ex != null) {
                log.warn("Analytics write failed: {}", ex.getMessage());
            } else if (r.isFailure()) {
                log.debug("Analytics write skipped: {}", r.getError());
            }
            return null;
        });
    }

    public CompletableFuture<AnalyticsSummary> summarize(LocalDate date) {
        final String day = (date == null ? LocalDate.now(clock.withZone(ZoneOffset.UTC)) : date).toString();
        if (!store.isConfigured()) {
            return CompletableFuture.completedFuture(AnalyticsSummary.empty(day));
        }
        List<StoreCommand> batch = new ArrayList<>();
        batch.add(StoreCommand.get(TOTAL));
        batch.add(StoreCommand.get(dailyKey(day)));
        batch.add(StoreCommand.pfCount("analytics:unique:apikeys:" + day));
        batch.add(StoreCommand.pfCount("analytics:unique:ips:" + day));
        batch.add(StoreCommand.get("analytics:latency:sum:" + day));
        batch.add(StoreCommand.get("analytics:latency:count:" + day));
        for (int h = 0; h < 24; h++) {
            batch.add(StoreCommand.get(String.format("analytics:requests:hourly:%sT%02d", day, h)));
        }
        return store.pipeline(batch).thenApply(r -> toSummary(day, r));
    }

    private AnalyticsSummary toSummary(String day, Result<List<Object>> r) {
        if (r.isFailure()) {
            log.debug("Analytics summary for {} unavailable: {}", day, r.getError());
            return AnalyticsSummary.empty(day);
        }
        List<Object> v = r.get();
        long latencySum = asLong(v.get(4));
        long latencyCount = asLong(v.get(5));
        List<Long> hourly = new ArrayList<>(24);
        for (int h = 0; h < 24; h++) {
            hourly.add(asLong(v.get(6 + h)));
        }
        return new AnalyticsSummary(day,
                asLong(v.get(0)),
                asLong(v.get(1)),
                asLong(v.get(2)),
                asLong(v.get(3)),
                latencyCount == 0 ? 0 : Math.round((double) latencySum / latencyCount),
                List.copyOf(hourly),
                true);
    }

    List<StoreCommand> commandsFor(RequestEvent e) {
        final Instant ts = e.timestamp() == null ? clock.instant() : e.timestamp();
        final String day = LocalDate.ofInstant(ts, ZoneOffset.UTC).toString();
        final String hourKey = "analytics:requests:hourly:" + HOUR.format(ts);
        final String endpointKey = "analytics:endpoint:" + e.endpoint() + ":" + day;
        final String statusKey = "analytics:status:" + e.statusCode() + ":" + day;
        final String sumKey = "analytics:latency:sum:" + day;
        final String countKey = "analytics:latency:count:" + day;
        final String distKey = "analytics:latency:dist:" + day;
        final long latency = Math.max(0L, e.latencyMs());

        List<StoreCommand> c = new ArrayList<>();
        c.add(StoreCommand.incr(TOTAL));
        c.add(StoreCommand.incr(dailyKey(day)));
        c.add(StoreCommand.incr(hourKey));
        c.add(StoreCommand.incr(endpointKey));
        c.add(StoreCommand.incr(statusKey));
        c.add(StoreCommand.incrBy(sumKey, latency));
        c.add(StoreCommand.incr(countKey));
        for (String k : List.of(dailyKey(day), hourKey, endpointKey, statusKey, sumKey, countKey)) {
            c.add(StoreCommand.expire(k, retentionSeconds));
        }
        if (e.apiKey() != null && !e.apiKey().isBlank()) {
            String k = "analytics:unique:apikeys:" + day;
            c.add(StoreCommand.pfAdd(k, e.apiKey()));
            c.add(StoreCommand.expire(k, retentionSeconds));
        }
        if (e.ip() != null && !e.ip().isBlank()) {
            String k = "analytics:unique:ips:" + day;
            c.add(StoreCommand.pfAdd(k, e.ip()));
            c.add(StoreCommand.expire(k, retentionSeconds));
        }
        c.add(StoreCommand.zAdd(distKey, latency, ts.toEpochMilli() + "-" + ThreadLocalRandom.current().nextInt(1_000_000)));
        c.add(StoreCommand.expire(distKey, retentionSeconds));
        return c;
    }

    private static String dailyKey(String day) {
        return "analytics:requests:daily:" + day;
    }

    private static long asLong(Object o) {
        if (o == null) return 0L;
        if (o instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(o.toString().trim());
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }
}
