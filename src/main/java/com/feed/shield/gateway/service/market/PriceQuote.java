package com.feed.shield.gateway.service.market;

import java.time.Instant;

public record PriceQuote(String coinId, String currency, double price, Double change24h,
                         Instant lastUpdatedAt, Instant fetchedAt) {
}
