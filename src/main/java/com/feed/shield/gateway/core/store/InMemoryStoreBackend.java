package com.feed.shield.gateway.core.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory implementation of the shared store primitives.
 * Intended for local/dev/testing only (single JVM): it shares nothing across workers.
 * Each call runs under one lock, so a pipeline is applied atomically.
 */
public final class InMemoryStoreBackend implements StoreBackend {

    private static final class Entry {
        Object v; // String, ScoredSet or HyperLogLog
        long expAtMillis; // 0 = no expiry
    }

    private final Map<String, Entry> map = new HashMap<>();
    private final String prefix; // e.g., "fs:"
    private final Clock clock;

    public InMemoryStoreBackend(String prefix, Clock clock) {
        this.prefix = prefix == null ? "" : prefix;
        this.clock = clock;
    }

    private static boolean isExpired(Entry e, long now) {
        return e != null && e.expAtMillis > 0 && now >= e.expAtMillis;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public String name() {
        return "in-memory";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CompletableFuture<List<Object>> execute(List<StoreCommand> commands) {
        try {
            List<Object> replies = new ArrayList<>(commands.size());
            synchronized (map) {
                final long now = clock.millis();
                for (StoreCommand c : commands) {
                    replies.add(StoreReplies.normalize(c.op(), apply(c, now)));
                }
            }
            return CompletableFuture.completedFuture(replies);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    @Override
    public CompletableFuture<Long> keyCount() {
        synchronized (map) {
            final long now = clock.millis();
            map.values().removeIf(e -> isExpired(e, now));
            return CompletableFuture.completedFuture((long) map.size());
        }
    }

    @Override
    public CompletableFuture<Long> deleteByPrefix(String keyPrefix) {
        final String full = k(keyPrefix);
        synchronized (map) {
            final long now = clock.millis();
            long removed = 0;
            var it = map.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Entry> e = it.next();
                if (e.getKey().startsWith(full)) {
                    if (!isExpired(e.getValue(), now)) removed++;
                    it.remove();
                }
            }
            return CompletableFuture.completedFuture(removed);
        }
    }

    private Object apply(StoreCommand c, long now) {
        final String kk = k(c.key());
        Entry e = live(kk, now);
        switch (c.op()) {
            case GET:
                return e == null ? null : typed(e, String.class, kk);
            case SETEX: {
                Entry fresh = new Entry();
                fresh.v = c.arg(1);
                fresh.expAtMillis = now + c.longArg(0) * 1000L;
                map.put(kk, fresh);
                return "OK";
            }
            case DEL:
                return map.remove(kk) != null ? 1L : 0L;
            case INCR:
            case INCRBY: {
                long delta = c.op() == StoreOp.INCR ? 1L : c.longArg(0);
                if (e == null) {
                    e = new Entry();
                    e.v = "0";
                    map.put(kk, e);
                }
                long val;
                try {
                    val = Long.parseLong(typed(e, String.class, kk));
                } catch (NumberFormatException ex) {
                    throw new IllegalStateException("ERR value is not an integer at " + kk);
                }
                // expiry of an existing counter is preserved
                e.v = Long.toString(val + delta);
                return val + delta;
            }
            case EXPIRE:
            case PEXPIRE: {
                if (e == null) return false;
                long ms = c.op() == StoreOp.EXPIRE ? c.longArg(0) * 1000L : c.longArg(0);
                e.expAtMillis = now + ms;
                return true;
            }
            case ZADD: {
                if (e == null) {
                    e = new Entry();
                    e.v = new ScoredSet();
                    map.put(kk, e);
                }
                return typed(e, ScoredSet.class, kk).add(c.doubleArg(0), c.arg(1));
            }
            case ZCARD:
                return e == null ? 0L : (long) typed(e, ScoredSet.class, kk).size();
            case ZREMRANGEBYSCORE: {
                if (e == null) return 0L;
                ScoredSet set = typed(e, ScoredSet.class, kk);
                long removed = set.removeRangeByScore(c.doubleArg(0), c.doubleArg(1));
                if (set.isEmpty()) map.remove(kk);
                return removed;
            }
            case ZMINSCORE:
                return e == null ? null : typed(e, ScoredSet.class, kk).minScore();
            case PFADD: {
                if (e == null) {
                    e = new Entry();
                    e.v = new HyperLogLog();
                    map.put(kk, e);
                }
                HyperLogLog hll = typed(e, HyperLogLog.class, kk);
                boolean changed = false;
                for (String member : c.args()) {
                    changed |= hll.add(member);
                }
                return changed;
            }
            case PFCOUNT:
                return e == null ? 0L : typed(e, HyperLogLog.class, kk).count();
            default:
                throw new IllegalArgumentException("Unsupported op " + c.op());
        }
    }

    private Entry live(String kk, long now) {
        Entry e = map.get(kk);
        if (isExpired(e, now)) {
            map.remove(kk);
            return null;
        }
        return e;
    }

    private static <T> T typed(Entry e, Class<T> type, String key) {
        if (!type.isInstance(e.v)) {
            throw new IllegalStateException("WRONGTYPE operation against key " + key);
        }
        return type.cast(e.v);
    }
}
