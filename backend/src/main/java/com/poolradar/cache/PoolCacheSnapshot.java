package com.poolradar.cache;

import java.util.Map;

/**
 * Durable form of the cache: unexpired entries by key, counters at save time, and the save time itself.
 */
public record PoolCacheSnapshot(Map<String, CacheEntry> cache, CacheStats stats, long timestamp) {

    public PoolCacheSnapshot {
        cache = cache != null ? Map.copyOf(cache) : Map.of();
        stats = stats != null ? stats : CacheStats.empty();
    }
}
