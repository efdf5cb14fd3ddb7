package com.feed.shield.gateway.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feed.shield.gateway.common.Result;
import com.feed.shield.gateway.common.exception.Http;
import com.feed.shield.gateway.service.ratelimit.ClientIdentity;
import com.feed.shield.gateway.service.ratelimit.RateLimitDecision;
import com.feed.shield.gateway.service.ratelimit.RateLimitService;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Admission control for public API calls. Denied requests get a 429 with the standard
 * rate-limit headers; admitted ones get the same headers on the way through.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String HEADER_API_KEY = "X-API-Key";
    public static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";
    static final String CLIENT_ATTR = RateLimitInterceptor.class.getName() + ".client";

    private static final long DECISION_TIMEOUT_MS = 5_000;

    private final RateLimitService rateLimits;
    private final ObjectMapper mapper;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (request.getDispatcherType() == DispatcherType.ASYNC) {
            return true; // already admitted on the initial dispatch
        }
        ClientIdentity client = clientOf(request);
        if (!rateLimits.isEnabled()) {
            return true;
        }

        final RateLimitDecision decision;
        try {
            decision = rateLimits.check(client).get(DECISION_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException ex) {
            log.warn("Rate limit check for {} failed, admitting: {}", client.identifier(), ex.toString());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Rate limit check for {} interrupted, admitting", client.identifier());
            return true;
        }

        decision.headers().forEach(response::setHeader);
        if (decision.allowed()) {
            return true;
        }
        Result<?> denied = Result.fail(Http.RATE_LIMITED,
                "Rate limit exceeded for tier " + decision.tier() + ", retry in " + decision.retryAfterSeconds() + " s");
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        mapper.writeValue(response.getOutputStream(), Http.body(denied));
        return false;
    }

    static ClientIdentity clientOf(HttpServletRequest request) {
        Object cached = request.getAttribute(CLIENT_ATTR);
        if (cached instanceof ClientIdentity c) {
            return c;
        }
        ClientIdentity client = ClientIdentity.resolve(request.getHeader(HEADER_API_KEY),
                request.getHeader(HEADER_FORWARDED_FOR), request.getRemoteAddr());
        request.setAttribute(CLIENT_ATTR, client);
        return client;
    }
}
