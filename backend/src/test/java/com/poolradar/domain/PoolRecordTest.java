package com.poolradar.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoolRecordTest {

    @Test
    void tokensAreStoredInCanonicalOrderWithTheirAggregates() {
        PoolRecord pool = PoolRecord.builder()
                .address("0x88E6A0C2DDD26FEEB64F039A2C41296FCB3F5640")
                .chainId(1)
                .tokenA(PoolFixtures.weth())
                .tokenB(PoolFixtures.usdc())
                .feeTier(FeeTier.LOW)
                .totalValueLockedTokenA(new BigDecimal("50000"))
                .totalValueLockedTokenB(new BigDecimal("150000000"))
                .feeGrowthGlobalAX128(BigInteger.ONE)
                .feeGrowthGlobalBX128(BigInteger.TWO)
                .build();

        assertThat(pool.address()).isEqualTo(PoolFixtures.USDC_WETH_POOL);
        assertThat(pool.tokenA().symbol()).isEqualTo("USDC");
        assertThat(pool.tokenB().symbol()).isEqualTo("WETH");
        assertThat(pool.totalValueLockedTokenA()).isEqualByComparingTo("150000000");
        assertThat(pool.totalValueLockedTokenB()).isEqualByComparingTo("50000");
        assertThat(pool.feeGrowthGlobalAX128()).isEqualTo(BigInteger.TWO);
        assertThat(pool.feeGrowthGlobalBX128()).isEqualTo(BigInteger.ONE);
    }

    @Test
    void missingNumbersDefaultToZeroAndTickSpacingToTierDefault() {
        PoolRecord pool = PoolRecord.builder()
                .address(PoolFixtures.DAI_WETH_POOL)
                .chainId(1)
                .tokenA(PoolFixtures.dai())
                .tokenB(PoolFixtures.weth())
                .feeTier(FeeTier.HIGH)
                .build();
        assertThat(pool.liquidity()).isZero();
        assertThat(pool.volumeUSD()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(pool.tickSpacing()).isEqualTo(200);
    }

    @Test
    void requiresAddressTokensAndFeeTier() {
        assertThatThrownBy(() -> PoolRecord.builder().tokenA(PoolFixtures.dai()).tokenB(PoolFixtures.weth())
                .feeTier(FeeTier.LOW).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolRecord.builder().address(PoolFixtures.DAI_WETH_POOL).tokenA(PoolFixtures.dai())
                .feeTier(FeeTier.LOW).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolRecord.builder().address(PoolFixtures.DAI_WETH_POOL).tokenA(PoolFixtures.dai())
                .tokenB(PoolFixtures.weth()).build()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void feeTierLookup() {
        assertThat(FeeTier.fromValue(3000)).contains(FeeTier.MEDIUM);
        assertThat(FeeTier.fromValue(2500)).isEmpty();
        assertThat(FeeTier.LOWEST.tickSpacing()).isEqualTo(1);
    }
}
