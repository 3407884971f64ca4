package com.poolradar.resolver;

import com.poolradar.domain.PoolRecord;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Client-side filtering over already fetched pools.
 */
public final class PoolFilters {

    private PoolFilters() {
    }

    public static List<PoolRecord> apply(List<PoolRecord> pools, PoolSearchOptions options) {
        if (options == null) {
            return List.copyOf(pools);
        }
        return pools.stream().filter(matching(options)).toList();
    }

    static Predicate<PoolRecord> matching(PoolSearchOptions options) {
        return pool -> (options.feeTiers().isEmpty() || options.feeTiers().contains(pool.feeTier()))
                && (options.minTvlUsd() == null || pool.totalValueLockedUSD().compareTo(options.minTvlUsd()) >= 0)
                && (options.minVolumeUsd() == null || pool.volumeUSD().compareTo(options.minVolumeUsd()) >= 0);
    }

    /**
     * Case-insensitive substring match against either token symbol.
     */
    public static boolean symbolMatches(PoolRecord pool, String query) {
        String q = query.toLowerCase(Locale.ROOT);
        return pool.tokenA().symbol().toLowerCase(Locale.ROOT).contains(q)
                || pool.tokenB().symbol().toLowerCase(Locale.ROOT).contains(q);
    }
}
