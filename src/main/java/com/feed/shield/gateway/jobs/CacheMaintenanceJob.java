package com.feed.shield.gateway.jobs;

import com.feed.shield.gateway.service.cache.CacheOrchestrator;
import com.feed.shield.gateway.service.ratelimit.LocalRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Housekeeping for per-worker state. Reads never depend on it having run:
 * expired cache entries are already invisible, ended fallback windows already reset.
 * <p>
 * Configure (optional):
 * shield.maintenance.sweep-interval=PT60S
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheMaintenanceJob {

    private final CacheOrchestrator cache;
    private final LocalRateLimiter fallbackLimiter;

    @Scheduled(fixedDelayString = "${shield.maintenance.sweep-interval:PT60S}",
            initialDelayString = "${shield.maintenance.sweep-interval:PT60S}")
    public void sweep() {
        long t0 = System.currentTimeMillis();
        try {
            int purged = cache.sweepLocal();
            int windows = fallbackLimiter.purgeExpired();
            if (purged > 0 || windows > 0) {
                log.info("Maintenance sweep: {} cache entries, {} limiter windows purged ({} ms)",
                        purged, windows, System.currentTimeMillis() - t0);
            }
        } catch (RuntimeException t) {
            log.warn("Maintenance sweep error: {}", t.getMessage(), t);
        }
    }
}
