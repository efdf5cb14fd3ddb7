package com.feed.shield.gateway.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "shield")
public class ShieldProperties {

    private Store store = new Store();
    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();
    private Analytics analytics = new Analytics();
    private Upstream upstream = new Upstream();

    @Data
    public static class Store {
        private String redisUrl;        // redis://[:password@]host:port[/db], rediss:// for TLS
        private String restUrl;         // Upstash-style REST endpoint
        private String restToken;
        private boolean inMemory = false;
        private String keyPrefix = "fs:";
        private Duration timeout = Duration.ofSeconds(2);
        private Duration reconnectBase = Duration.ofMillis(200);
        private Duration reconnectMax = Duration.ofSeconds(3);
        private int threads = 8;
    }

    @Data
    public static class Cache {
        private int maxSize = 1000;
        private double retentionFactor = 2.0;
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private int refreshThreads = 4;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private long freePerDay = 100;
        private long proPerDay = 10_000;
        private long enterprisePerDay = 100_000;
        private long burstPerMinute = 60;
        private Duration dailyWindow = Duration.ofDays(1);
        private Duration burstWindow = Duration.ofMinutes(1);
    }

    @Data
    public static class Analytics {
        private boolean enabled = true;
        private int retentionDays = 30;
    }

    @Data
    public static class Upstream {
        private String baseUrl = "https://api.coingecko.com/api/v3";
        private String currency = "usd";
        private Duration timeout = Duration.ofSeconds(8);
    }
}
