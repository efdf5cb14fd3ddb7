package com.feed.shield.gateway.service.ratelimit;

import com.feed.shield.gateway.common.constants.ShieldProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates the client's daily quota and the burst limit in parallel and combines them.
 * Admission requires every tier to allow. When denied, the denying tier with the longest
 * reset is reported; when allowed, the tier closest to exhaustion.
 */
@Slf4j
@Service
public class RateLimitService {

    public static final String BURST = "BURST";

    private final SlidingWindowRateLimiter limiter;
    private final ShieldProperties.RateLimit config;

    public RateLimitService(SlidingWindowRateLimiter limiter, ShieldProperties props) {
        this.limiter = limiter;
        this.config = props.getRateLimit();
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public long dailyQuota(ClientTier tier) {
        return switch (tier) {
            case FREE -> config.getFreePerDay();
            case PRO -> config.getProPerDay();
            case ENTERPRISE -> config.getEnterprisePerDay();
        };
    }

    public CompletableFuture<RateLimitDecision> check(ClientIdentity client) {
        String daily = client.tier().name();
        CompletableFuture<RateLimitDecision> quota = limiter
                .checkLimit(client.identifier(), dailyQuota(client.tier()), config.getDailyWindow().toMillis())
                .thenApply(d -> d.withTier(daily));
        CompletableFuture<RateLimitDecision> burst = limiter
                .checkLimit("burst:" + client.identifier(), config.getBurstPerMinute(), config.getBurstWindow().toMillis())
                .thenApply(d -> d.withTier(BURST));
        return quota.thenCombine(burst, (q, b) -> {
            RateLimitDecision decision = combine(List.of(q, b));
            if (!decision.allowed()) {
                log.info("Rate limited {} on tier {} (retry in {} s)", client.identifier(), decision.tier(),
                        decision.retryAfterSeconds());
            }
            return decision;
        });
    }

    public static RateLimitDecision combine(List<RateLimitDecision> decisions) {
        if (decisions.isEmpty()) {
            throw new IllegalArgumentException("nothing to combine");
        }
        return decisions.stream()
                .filter(d -> !d.allowed())
                .max(Comparator.comparingLong(RateLimitDecision::resetInMs))
                .orElseGet(() -> decisions.stream()
                        .min(Comparator.comparingLong(RateLimitDecision::remaining))
                        .orElseThrow());
    }
}
