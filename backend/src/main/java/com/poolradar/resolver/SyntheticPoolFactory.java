package com.poolradar.resolver;

import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolRecord;
import com.poolradar.domain.TokenInfo;

import java.math.BigInteger;

/**
 * Builds structurally valid placeholders: price 1 (sqrtPriceX96 = 2^96), tick 0, zero liquidity and zero
 * aggregates. Unknown tokens and pool addresses are the zero address.
 */
final class SyntheticPoolFactory {

    static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    static final BigInteger UNIT_SQRT_PRICE_X96 = BigInteger.ONE.shiftLeft(96);

    private SyntheticPoolFactory() {
    }

    static PoolRecord forAddress(String address, int chainId) {
        return base(address, TokenInfo.ofAddress(ZERO_ADDRESS), TokenInfo.ofAddress(ZERO_ADDRESS), FeeTier.MEDIUM, chainId);
    }

    static PoolRecord forTokens(String tokenA, String tokenB, FeeTier feeTier, int chainId) {
        return base(ZERO_ADDRESS, TokenInfo.ofAddress(tokenA), TokenInfo.ofAddress(tokenB), feeTier, chainId);
    }

    private static PoolRecord base(String address, TokenInfo tokenA, TokenInfo tokenB, FeeTier feeTier, int chainId) {
        return PoolRecord.builder()
                .address(address)
                .chainId(chainId)
                .tokenA(tokenA)
                .tokenB(tokenB)
                .feeTier(feeTier)
                .sqrtPriceX96(UNIT_SQRT_PRICE_X96)
                .tick(0)
                .build();
    }
}
