package com.feed.shield.gateway.core.store;

import java.nio.charset.StandardCharsets;

/**
 * Constant-memory distinct counter (HyperLogLog, 2^14 registers, ~0.8% standard error).
 * Not thread-safe; callers synchronize.
 */
public final class HyperLogLog {

    private static final int P = 14;
    private static final int M = 1 << P;
    private static final double ALPHA = 0.7213 / (1.0 + 1.079 / M);

    private final byte[] registers = new byte[M];

    /**
     * @return true when an internal register changed (same meaning as PFADD's reply)
     */
    public boolean add(String member) {
        long h = hash64(member);
        int idx = (int) (h >>> (64 - P));
        long w = (h << P) | (1L << (P - 1));
        byte rho = (byte) (Long.numberOfLeadingZeros(w) + 1);
        if (rho > registers[idx]) {
            registers[idx] = rho;
            return true;
        }
        return false;
    }

    public long count() {
        double sum = 0.0;
        int zeros = 0;
        for (byte r : registers) {
            sum += 1.0 / (1L << r);
            if (r == 0) zeros++;
        }
        double estimate = ALPHA * M * M / sum;
        if (estimate <= 2.5 * M && zeros > 0) {
            // small-range correction: linear counting
            estimate = M * Math.log((double) M / zeros);
        }
        return Math.round(estimate);
    }

    // FNV-1a over UTF-8, then the murmur3 fmix64 finalizer to spread the bits.
    static long hash64(String s) {
        long h = 0xcbf29ce484222325L;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= 0x100000001b3L;
        }
        h ^= h >>> 33;
        h *= 0xff51afd7ed558ccdL;
        h ^= h >>> 33;
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= h >>> 33;
        return h;
    }
}
