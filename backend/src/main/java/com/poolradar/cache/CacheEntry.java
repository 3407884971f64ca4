package com.poolradar.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.poolradar.domain.PoolRecord;
import com.poolradar.domain.PoolSource;
import com.poolradar.domain.TokenInfo;

/**
 * Cached pool with the time it was stored, its own TTL and the source that produced it.
 */
public record CacheEntry(PoolRecord data, long storedAt, long ttlMs, PoolSource source) {

    /** Per-entry bookkeeping on top of the field payload. */
    private static final int ENTRY_OVERHEAD_BYTES = 256;

    /**
     * Expired strictly after {@code storedAt + ttlMs}.
     */
    public boolean isExpired(long nowMs) {
        return nowMs > storedAt + ttlMs;
    }

    public long expiresAt() {
        return storedAt + ttlMs;
    }

    /**
     * Rough size: two bytes per character of the textual fields plus a fixed overhead.
     */
    @JsonIgnore
    public long approxSizeBytes() {
        long chars = len(data.address())
                + token(data.tokenA()) + token(data.tokenB())
                + len(data.sqrtPriceX96().toString()) + len(data.liquidity().toString())
                + len(data.volumeUSD().toPlainString()) + len(data.totalValueLockedUSD().toPlainString())
                + len(data.totalValueLockedTokenA().toPlainString()) + len(data.totalValueLockedTokenB().toPlainString())
                + len(data.feesUSD().toPlainString())
                + len(data.feeGrowthGlobalAX128().toString()) + len(data.feeGrowthGlobalBX128().toString());
        return chars * 2 + ENTRY_OVERHEAD_BYTES;
    }

    private static long token(TokenInfo t) {
        return len(t.address()) + len(t.symbol()) + len(t.name());
    }

    private static long len(String s) {
        return s != null ? s.length() : 0;
    }
}
