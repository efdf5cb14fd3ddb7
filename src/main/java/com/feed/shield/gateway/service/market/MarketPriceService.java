package com.feed.shield.gateway.service.market;

import com.feed.shield.gateway.common.constants.CacheKeys;
import com.feed.shield.gateway.common.exception.ValidationException;
import com.feed.shield.gateway.service.cache.CacheOrchestrator;
import com.feed.shield.gateway.service.cache.CacheTtl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

@Service
public class MarketPriceService {

    private static final Pattern COIN_ID = Pattern.compile("[a-z0-9-]{1,64}");

    private final CacheOrchestrator cache;
    private final UpstreamPriceClient client;
    private final Executor upstreamExecutor;

    public MarketPriceService(CacheOrchestrator cache, UpstreamPriceClient client,
                              @Qualifier("upstreamExecutor") Executor upstreamExecutor) {
        this.cache = cache;
        this.client = client;
        this.upstreamExecutor = upstreamExecutor;
    }

    public CompletableFuture<PriceQuote> getPrice(String coinId) {
        String id = coinId == null ? "" : coinId.trim().toLowerCase(Locale.ROOT);
        if (!COIN_ID.matcher(id).matches()) {
            throw new ValidationException("Invalid coin id: " + coinId);
        }
        return cache.withCache(CacheKeys.marketPrice(id), CacheTtl.LIVE_PRICE, PriceQuote.class,
                () -> CompletableFuture.supplyAsync(() -> client.fetchPrice(id), upstreamExecutor));
    }
}
