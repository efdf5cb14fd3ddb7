package com.feed.shield.gateway.web;

import com.feed.shield.gateway.service.analytics.RequestEvent;
import com.feed.shield.gateway.service.analytics.UsageAnalyticsService;
import com.feed.shield.gateway.service.ratelimit.ClientIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.time.Clock;

/**
 * Records one analytics event per completed request, after the response is written.
 * Denied (429) requests are counted too.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UsageTrackingInterceptor implements HandlerInterceptor {

    static final String START_ATTR = UsageTrackingInterceptor.class.getName() + ".start";

    private final UsageAnalyticsService analytics;
    private final Clock clock;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (request.getAttribute(START_ATTR) == null) {
            request.setAttribute(START_ATTR, System.nanoTime());
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        try {
            Object start = request.getAttribute(START_ATTR);
            long latencyMs = start instanceof Long t0 ? (System.nanoTime() - t0) / 1_000_000L : 0L;
            Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
            String endpoint = pattern != null ? pattern.toString() : request.getRequestURI();
            ClientIdentity client = RateLimitInterceptor.clientOf(request);
            analytics.track(new RequestEvent(endpoint, request.getMethod(), response.getStatus(), latencyMs,
                    client.apiKey(), client.ip(), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Usage tracking failed for {}: {}", request.getRequestURI(), e.getMessage());
        }
    }
}
