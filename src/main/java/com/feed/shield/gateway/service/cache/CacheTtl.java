package com.feed.shield.gateway.service.cache;

/**
 * TTL presets per volatility class, in seconds.
 */
public enum CacheTtl {
    LIVE_PRICE(30),
    AGGREGATE(300),
    STATIC_REFERENCE(3600),

    NEWS_FEED(300),
    ARTICLE(3600),
    SEARCH(600),
    TRENDING(300),
    BREAKING(60),
    SOURCES(3600),

    MARKET_PRICE(30),
    MARKET_HISTORY(300),

    AI_SUMMARY(86400),
    AI_SENTIMENT(86400),
    AI_TRANSLATION(86400);

    private final long seconds;

    CacheTtl(long seconds) {
        this.seconds = seconds;
    }

    public long seconds() {
        return seconds;
    }
}
