package com.poolradar.source.indexed;

import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolRecord;
import com.poolradar.domain.TokenInfo;
import com.poolradar.source.UpstreamException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Validates an indexed-service pool and converts it to a {@link PoolRecord}. Any missing required field or
 * unparsable number fails the whole response with {@link UpstreamException}.
 */
public final class SubgraphPoolMapper {

    private SubgraphPoolMapper() {}

    public static PoolRecord toRecord(SubgraphPool pool, int chainId) {
        if (pool == null) {
            throw new UpstreamException("Malformed pool: null");
        }
        String id = required(pool.id(), "id", "?");
        int feeValue = parseInt(required(pool.feeTier(), "feeTier", id), "feeTier", id);
        FeeTier feeTier = FeeTier.fromValue(feeValue)
                .orElseThrow(() -> new UpstreamException("Malformed pool " + id + ": unknown feeTier " + feeValue));
        return PoolRecord.builder()
                .address(id)
                .chainId(chainId)
                .tokenA(toToken(pool.token0(), "token0", id))
                .tokenB(toToken(pool.token1(), "token1", id))
                .feeTier(feeTier)
                .sqrtPriceX96(bigInteger(pool.sqrtPrice(), "sqrtPrice", id))
                .liquidity(bigInteger(pool.liquidity(), "liquidity", id))
                // uninitialized pools report a null tick
                .tick(pool.tick() != null ? parseInt(pool.tick(), "tick", id) : 0)
                .tickSpacing(pool.tickSpacing() != null ? parseInt(pool.tickSpacing(), "tickSpacing", id) : feeTier.tickSpacing())
                .createdAtTimestamp(pool.createdAtTimestamp() != null ? parseLong(pool.createdAtTimestamp(), "createdAtTimestamp", id) : 0L)
                .createdAtBlock(pool.createdAtBlockNumber() != null ? parseLong(pool.createdAtBlockNumber(), "createdAtBlockNumber", id) : 0L)
                .volumeUSD(decimal(pool.volumeUSD(), "volumeUSD", id))
                .totalValueLockedUSD(decimal(pool.totalValueLockedUSD(), "totalValueLockedUSD", id))
                .totalValueLockedTokenA(decimal(pool.totalValueLockedToken0(), "totalValueLockedToken0", id))
                .totalValueLockedTokenB(decimal(pool.totalValueLockedToken1(), "totalValueLockedToken1", id))
                .feesUSD(decimal(pool.feesUSD(), "feesUSD", id))
                .feeGrowthGlobalAX128(bigInteger(pool.feeGrowthGlobal0X128(), "feeGrowthGlobal0X128", id))
                .feeGrowthGlobalBX128(bigInteger(pool.feeGrowthGlobal1X128(), "feeGrowthGlobal1X128", id))
                .build();
    }

    private static TokenInfo toToken(SubgraphToken token, String field, String poolId) {
        if (token == null) {
            throw new UpstreamException("Malformed pool " + poolId + ": missing " + field);
        }
        String address = required(token.id(), field + ".id", poolId);
        int decimals = token.decimals() != null ? parseInt(token.decimals(), field + ".decimals", poolId) : 18;
        if (decimals < 0) {
            throw new UpstreamException("Malformed pool " + poolId + ": negative " + field + ".decimals");
        }
        return new TokenInfo(address, token.symbol(), token.name(), decimals);
    }

    private static String required(String value, String field, String poolId) {
        if (value == null || value.isBlank()) {
            throw new UpstreamException("Malformed pool " + poolId + ": missing " + field);
        }
        return value;
    }

    private static long parseLong(String value, String field, String poolId) {
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new UpstreamException("Malformed pool " + poolId + ": " + field + "=" + value, e);
        }
    }

    private static int parseInt(String value, String field, String poolId) {
        try {
            return Math.toIntExact(parseLong(value, field, poolId));
        } catch (ArithmeticException e) {
            throw new UpstreamException("Malformed pool " + poolId + ": " + field + " out of range: " + value, e);
        }
    }

    private static BigInteger bigInteger(String value, String field, String poolId) {
        if (value == null) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(value.strip());
        } catch (NumberFormatException e) {
            throw new UpstreamException("Malformed pool " + poolId + ": " + field + "=" + value, e);
        }
    }

    private static BigDecimal decimal(String value, String field, String poolId) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value.strip());
        } catch (NumberFormatException e) {
            throw new UpstreamException("Malformed pool " + poolId + ": " + field + "=" + value, e);
        }
    }
}
