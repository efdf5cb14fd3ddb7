package com.feed.shield.gateway.core.store;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Score-ordered set of unique members, the in-process counterpart of a Redis sorted set.
 * Not thread-safe; callers synchronize.
 */
public final class ScoredSet {

    private record Scored(double score, String member) {
    }

    private final Map<String, Double> scores = new HashMap<>();
    private final TreeSet<Scored> ordered = new TreeSet<>(
            Comparator.comparingDouble(Scored::score).thenComparing(Scored::member));

    /**
     * @return true when the member was not present before
     */
    public boolean add(double score, String member) {
        Double previous = scores.put(member, score);
        if (previous != null) {
            ordered.remove(new Scored(previous, member));
        }
        ordered.add(new Scored(score, member));
        return previous == null;
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    /**
     * Removes members with min <= score <= max.
     */
    public long removeRangeByScore(double min, double max) {
        long removed = 0;
        while (!ordered.isEmpty() && ordered.first().score() <= max) {
            Scored s = ordered.first();
            if (s.score() < min) {
                // rare: min above the lowest score; walk the tail instead
                return removed + removeRangeSlow(min, max);
            }
            ordered.pollFirst();
            scores.remove(s.member());
            removed++;
        }
        return removed;
    }

    public Double minScore() {
        return ordered.isEmpty() ? null : ordered.first().score();
    }

    private long removeRangeSlow(double min, double max) {
        long removed = 0;
        var it = ordered.iterator();
        while (it.hasNext()) {
            Scored s = it.next();
            if (s.score() > max) break;
            if (s.score() >= min) {
                it.remove();
                scores.remove(s.member());
                removed++;
            }
        }
        return removed;
    }
}
