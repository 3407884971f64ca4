package com.poolradar.cache;

/**
 * Point-in-time cache counters. {@code hitRate} is hits / (hits + misses), 0 before any lookup.
 */
public record CacheStats(long hits, long misses, long evictions, int size, double hitRate, long approxMemoryBytes) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0.0, 0);
    }

    static double hitRate(long hits, long misses) {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
