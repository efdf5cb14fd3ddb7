package com.feed.shield.gateway.service.ratelimit;

/**
 * Who is calling: the API key when one is presented, else the client address.
 *
 * @param identifier stable limiter identity, {@code key:...} or {@code ip:...}
 * @param apiKey     presented key, may be null
 * @param ip         best-known client address, may be null
 */
public record ClientIdentity(String identifier, String apiKey, String ip, ClientTier tier) {

    public static ClientIdentity resolve(String apiKeyHeader, String forwardedFor, String remoteAddr) {
        String ip = firstForwarded(forwardedFor);
        if (ip == null) {
            ip = blankToNull(remoteAddr);
        }
        String apiKey = blankToNull(apiKeyHeader);
        if (apiKey != null) {
            return new ClientIdentity("key:" + apiKey, apiKey, ip, ClientTier.fromApiKey(apiKey));
        }
        return new ClientIdentity("ip:" + (ip == null ? "unknown" : ip), null, ip, ClientTier.FREE);
    }

    private static String firstForwarded(String header) {
        if (header == null) return null;
        int comma = header.indexOf(',');
        return blankToNull(comma >= 0 ? header.substring(0, comma) : header);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
