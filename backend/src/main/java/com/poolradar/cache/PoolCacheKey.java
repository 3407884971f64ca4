package com.poolradar.cache;

import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolRecord;

/**
 * Cache key for one pool. Every call site derives keys through these factories so that the same logical
 * pool always maps to the same key: addresses are lowercased and token pairs are put in canonical order.
 */
public record PoolCacheKey(String value) {

    private static final String ADDRESS_PREFIX = "pool:";
    private static final String PAIR_PREFIX = "pair:";

    public PoolCacheKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Invalid cache key parameters");
        }
    }

    /** {@code pool:{chainId}:{address}} */
    public static PoolCacheKey forAddress(int chainId, String poolAddress) {
        if (poolAddress == null || poolAddress.isBlank()) {
            throw new IllegalArgumentException("Invalid cache key parameters");
        }
        return new PoolCacheKey(ADDRESS_PREFIX + chainId + ":" + poolAddress.strip().toLowerCase());
    }

    /** {@code pair:{chainId}:{lowerToken}:{higherToken}:{fee}}, independent of argument order. */
    public static PoolCacheKey forPair(int chainId, String tokenA, String tokenB, FeeTier feeTier) {
        if (tokenA == null || tokenB == null || feeTier == null) {
            throw new IllegalArgumentException("Invalid cache key parameters");
        }
        String a = tokenA.strip().toLowerCase();
        String b = tokenB.strip().toLowerCase();
        String lower = a.compareTo(b) <= 0 ? a : b;
        String higher = a.compareTo(b) <= 0 ? b : a;
        return new PoolCacheKey(PAIR_PREFIX + chainId + ":" + lower + ":" + higher + ":" + feeTier.value());
    }

    public static PoolCacheKey forAddress(PoolRecord record) {
        return forAddress(record.chainId(), record.address());
    }

    public static PoolCacheKey forPair(PoolRecord record) {
        return forPair(record.chainId(), record.tokenA().address(), record.tokenB().address(), record.feeTier());
    }

    public boolean isAddressKey() {
        return value.startsWith(ADDRESS_PREFIX);
    }

    @Override
    public String toString() {
        return value;
    }
}
