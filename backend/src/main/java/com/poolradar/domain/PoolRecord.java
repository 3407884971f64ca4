package com.poolradar.domain;

import lombok.Builder;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Normalized state of one concentrated-liquidity pool on one chain.
 * <p>
 * Tokens are always held in canonical order (lower address first). When a caller supplies them the other
 * way round, the token-indexed aggregates (TVL per token, fee growth per token) are swapped with them.
 * Price and liquidity fields are pass-through values from the source.
 */
@Builder(toBuilder = true)
public record PoolRecord(
        String address,
        int chainId,
        TokenInfo tokenA,
        TokenInfo tokenB,
        FeeTier feeTier,
        BigInteger sqrtPriceX96,
        int tick,
        int tickSpacing,
        BigInteger liquidity,
        long createdAtTimestamp,
        long createdAtBlock,
        BigDecimal volumeUSD,
        BigDecimal totalValueLockedUSD,
        BigDecimal totalValueLockedTokenA,
        BigDecimal totalValueLockedTokenB,
        BigDecimal feesUSD,
        BigInteger feeGrowthGlobalAX128,
        BigInteger feeGrowthGlobalBX128
) {

    public PoolRecord {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("pool address is required");
        }
        if (tokenA == null || tokenB == null) {
            throw new IllegalArgumentException("both tokens are required");
        }
        if (feeTier == null) {
            throw new IllegalArgumentException("feeTier is required");
        }
        address = address.strip().toLowerCase();
        if (tokenA.address().compareTo(tokenB.address()) > 0) {
            TokenInfo t = tokenA;
            tokenA = tokenB;
            tokenB = t;
            BigDecimal tvl = totalValueLockedTokenA;
            totalValueLockedTokenA = totalValueLockedTokenB;
            totalValueLockedTokenB = tvl;
            BigInteger growth = feeGrowthGlobalAX128;
            feeGrowthGlobalAX128 = feeGrowthGlobalBX128;
            feeGrowthGlobalBX128 = growth;
        }
        sqrtPriceX96 = orZero(sqrtPriceX96);
        liquidity = orZero(liquidity);
        feeGrowthGlobalAX128 = orZero(feeGrowthGlobalAX128);
        feeGrowthGlobalBX128 = orZero(feeGrowthGlobalBX128);
        volumeUSD = orZero(volumeUSD);
        totalValueLockedUSD = orZero(totalValueLockedUSD);
        totalValueLockedTokenA = orZero(totalValueLockedTokenA);
        totalValueLockedTokenB = orZero(totalValueLockedTokenB);
        feesUSD = orZero(feesUSD);
        if (tickSpacing == 0) {
            tickSpacing = feeTier.tickSpacing();
        }
    }

    private static BigInteger orZero(BigInteger v) {
        return v != null ? v : BigInteger.ZERO;
    }

    private static BigDecimal orZero(BigDecimal v) {
        return v != null ? v : BigDecimal.ZERO;
    }
}
