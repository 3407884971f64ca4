package com.poolradar.source.indexed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Pool object as returned by the indexed service. Converted to a PoolRecord by {@link SubgraphPoolMapper}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubgraphPool(
        String id,
        SubgraphToken token0,
        SubgraphToken token1,
        String feeTier,
        String sqrtPrice,
        String liquidity,
        String tick,
        String tickSpacing,
        String createdAtTimestamp,
        String createdAtBlockNumber,
        String volumeUSD,
        String totalValueLockedUSD,
        String totalValueLockedToken0,
        String totalValueLockedToken1,
        String feesUSD,
        String feeGrowthGlobal0X128,
        String feeGrowthGlobal1X128
) {
}
