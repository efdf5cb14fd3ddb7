package com.feed.shield.gateway.service.ratelimit;

import java.util.Locale;

public enum ClientTier {
    FREE,
    PRO,
    ENTERPRISE;

    /**
     * Tier encoded in the API key prefix ({@code ent_}, {@code pro_}, {@code free_}); FREE otherwise.
     */
    public static ClientTier fromApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) return FREE;
        String k = apiKey.trim().toLowerCase(Locale.ROOT);
        if (k.startsWith("ent_")) return ENTERPRISE;
        if (k.startsWith("pro_")) return PRO;
        return FREE;
    }
}
