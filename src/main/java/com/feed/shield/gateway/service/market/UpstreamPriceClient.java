package com.feed.shield.gateway.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.feed.shield.gateway.common.constants.CacheKeys;
import com.feed.shield.gateway.common.constants.ShieldProperties;
import com.feed.shield.gateway.common.exception.UpstreamFetchFailedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;

/**
 * Blocking client for the public price API (CoinGecko simple/price).
 */
@Slf4j
@Component
public class UpstreamPriceClient {

    private final RestTemplate template;
    private final ShieldProperties.Upstream config;
    private final Clock clock;

    public UpstreamPriceClient(RestTemplate template, ShieldProperties props, Clock clock) {
        this.template = template;
        this.config = props.getUpstream();
        this.clock = clock;
    }

    @Retry(name = "upstreamPrices")
    @CircuitBreaker(name = "upstreamPrices", fallbackMethod = "fetchPriceFallback")
    public PriceQuote fetchPrice(String coinId) {
        String currency = config.getCurrency();
        String url = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/simple/price")
                .queryParam("ids", coinId)
                .queryParam("vs_currencies", currency)
                .queryParam("include_24hr_change", "true")
                .queryParam("include_last_updated_at", "true")
                .toUriString();
        log.debug("Fetching price for {} from upstream", coinId);
        JsonNode body = template.getForObject(url, JsonNode.class);
        JsonNode coin = body == null ? null : body.get(coinId);
        if (coin == null || !coin.hasNonNull(currency)) {
            throw new IllegalStateException("Upstream has no " + currency + " price for " + coinId);
        }
        Double change = coin.hasNonNull(currency + "_24h_change") ? coin.get(currency + "_24h_change").asDouble() : null;
        Instant updated = coin.hasNonNull("last_updated_at") ? Instant.ofEpochSecond(coin.get("last_updated_at").asLong()) : null;
        return new PriceQuote(coinId, currency, coin.get(currency).asDouble(), change, updated, clock.instant());
    }

    public PriceQuote fetchPriceFallback(String coinId, Throwable ex) {
        log.warn("fetchPrice fallback for {} due to {}", coinId, ex.toString());
        throw new UpstreamFetchFailedException(CacheKeys.marketPrice(coinId), "Upstream price path unavailable", ex);
    }
}
