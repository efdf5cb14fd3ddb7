package com.feed.shield.gateway.core.store;

import com.feed.shield.gateway.common.exception.StoreUnavailableException;
import org.springframework.data.redis.core.ZSetOperations;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Normalizes raw backend replies to the canonical Java type of each {@link StoreOp}:
 * STRING to String (or null), LONG to Long, BOOLEAN to Boolean, SCORE to Double (or null).
 */
final class StoreReplies {

    private StoreReplies() {
    }

    static Object normalize(StoreOp op, Object raw) {
        return switch (op.reply()) {
            case STRING -> raw == null ? null : String.valueOf(raw);
            case LONG -> toLong(raw);
            case BOOLEAN -> toBoolean(raw);
            case SCORE -> toScore(raw);
        };
    }

    private static Long toLong(Object raw) {
        if (raw == null) return 0L;
        if (raw instanceof Number n) return n.longValue();
        if (raw instanceof Boolean b) return b ? 1L : 0L;
        try {
            return Long.parseLong(String.valueOf(raw).trim());
        } catch (NumberFormatException ex) {
            throw new StoreUnavailableException("Unexpected integer reply: " + raw);
        }
    }

    private static Boolean toBoolean(Object raw) {
        if (raw == null) return Boolean.FALSE;
        if (raw instanceof Boolean b) return b;
        if (raw instanceof Number n) return n.longValue() != 0L;
        String s = String.valueOf(raw).trim();
        return "OK".equalsIgnoreCase(s) || "1".equals(s) || "true".equalsIgnoreCase(s);
    }

    private static Double toScore(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Number n) return n.doubleValue();
        if (raw instanceof Collection<?> c) {
            if (c.isEmpty()) return null;
            Iterator<?> it = c.iterator();
            Object first = it.next();
            if (first instanceof ZSetOperations.TypedTuple<?> tuple) {
                return tuple.getScore();
            }
            // JSON protocol flattens WITHSCORES replies to [member, score, ...]
            if (c instanceof List<?> list && list.size() >= 2) {
                return parseScore(list.get(1));
            }
            return parseScore(first);
        }
        return parseScore(raw);
    }

    private static Double parseScore(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(String.valueOf(raw).trim());
        } catch (NumberFormatException ex) {
            throw new StoreUnavailableException("Unexpected score reply: " + raw);
        }
    }
}
