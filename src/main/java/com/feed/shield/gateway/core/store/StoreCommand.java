package com.feed.shield.gateway.core.store;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A single store command against a logical (unprefixed) key.
 * Backends apply their namespace prefix and translate to their wire format.
 */
public record StoreCommand(StoreOp op, String key, List<String> args) {

    public StoreCommand {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(key, "key");
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static StoreCommand get(String key) {
        return new StoreCommand(StoreOp.GET, key, List.of());
    }

    public static StoreCommand setEx(String key, long ttlSeconds, String value) {
        return new StoreCommand(StoreOp.SETEX, key, List.of(Long.toString(ttlSeconds), value));
    }

    public static StoreCommand del(String key) {
        return new StoreCommand(StoreOp.DEL, key, List.of());
    }

    public static StoreCommand incr(String key) {
        return new StoreCommand(StoreOp.INCR, key, List.of());
    }

    public static StoreCommand incrBy(String key, long delta) {
        return new StoreCommand(StoreOp.INCRBY, key, List.of(Long.toString(delta)));
    }

    public static StoreCommand expire(String key, long ttlSeconds) {
        return new StoreCommand(StoreOp.EXPIRE, key, List.of(Long.toString(ttlSeconds)));
    }

    public static StoreCommand pExpire(String key, long ttlMillis) {
        return new StoreCommand(StoreOp.PEXPIRE, key, List.of(Long.toString(ttlMillis)));
    }

    public static StoreCommand zAdd(String key, double score, String member) {
        return new StoreCommand(StoreOp.ZADD, key, List.of(formatScore(score), member));
    }

    public static StoreCommand zCard(String key) {
        return new StoreCommand(StoreOp.ZCARD, key, List.of());
    }

    public static StoreCommand zRemoveRangeByScore(String key, double min, double max) {
        return new StoreCommand(StoreOp.ZREMRANGEBYSCORE, key, List.of(formatScore(min), formatScore(max)));
    }

    public static StoreCommand zMinScore(String key) {
        return new StoreCommand(StoreOp.ZMINSCORE, key, List.of());
    }

    public static StoreCommand pfAdd(String key, String... members) {
        return new StoreCommand(StoreOp.PFADD, key, Arrays.asList(members));
    }

    public static StoreCommand pfCount(String key) {
        return new StoreCommand(StoreOp.PFCOUNT, key, List.of());
    }

    /**
     * Glob pattern matching every key that starts with {@code literalPrefix}.
     */
    static String prefixPattern(String literalPrefix) {
        StringBuilder sb = new StringBuilder(literalPrefix.length() + 1);
        for (char ch : literalPrefix.toCharArray()) {
            if (ch == '*' || ch == '?' || ch == '[' || ch == ']' || ch == '\\') sb.append('\\');
            sb.append(ch);
        }
        return sb.append('*').toString();
    }

    public String arg(int i) {
        return args.get(i);
    }

    public long longArg(int i) {
        return Long.parseLong(args.get(i));
    }

    public double doubleArg(int i) {
        return Double.parseDouble(args.get(i));
    }

    // Whole-number scores (epoch millis) go out without a trailing ".0".
    static String formatScore(double score) {
        if (score == Math.rint(score) && Math.abs(score) < 1e15) {
            return Long.toString((long) score);
        }
        return Double.toString(score);
    }
}
