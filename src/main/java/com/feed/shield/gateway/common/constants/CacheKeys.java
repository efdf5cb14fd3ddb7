package com.feed.shield.gateway.common.constants;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Key builders for every cached family. Keys are logical; the store adapter adds its namespace.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String newsFeed(String source, String category, Integer page, Integer limit) {
        StringBuilder sb = new StringBuilder("news");
        if (hasText(source)) sb.append(":s:").append(source);
        if (hasText(category)) sb.append(":c:").append(category);
        if (page != null && page > 0) sb.append(":p:").append(page);
        if (limit != null && limit > 0) sb.append(":l:").append(limit);
        return sb.toString();
    }

    public static String article(String id) {
        return "article:" + id;
    }

    public static String search(String query, Integer page) {
        String normalized = query == null ? "" : query.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", "-");
        if (normalized.length() > 50) normalized = normalized.substring(0, 50);
        return (page != null && page > 0) ? "search:" + normalized + ":p" + page : "search:" + normalized;
    }

    public static String trending() {
        return "news:trending";
    }

    public static String breaking() {
        return "news:breaking";
    }

    public static String sources() {
        return "sources:all";
    }

    public static String marketPrice(String coinId) {
        return "market:price:" + coinId;
    }

    public static String marketHistory(String coinId, int days) {
        return "market:history:" + coinId + ":" + days + "d";
    }

    public static String aiSummary(String articleId) {
        return "ai:summary:" + articleId;
    }

    public static String aiSentiment(String articleId) {
        return "ai:sentiment:" + articleId;
    }

    public static String aiTranslation(String articleId, String lang) {
        return "ai:translate:" + articleId + ":" + lang;
    }

    /**
     * {@code prefix:k1=v1&k2=v2} with parameters sorted by name and null values dropped;
     * {@code prefix:default} when nothing is left.
     */
    public static String fromParams(String prefix, Map<String, ?> params) {
        Objects.requireNonNull(prefix, "prefix");
        String joined = params == null ? "" : new TreeMap<>(params).entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        return prefix + ":" + (joined.isEmpty() ? "default" : joined);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
