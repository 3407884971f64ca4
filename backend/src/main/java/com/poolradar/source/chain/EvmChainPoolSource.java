package com.poolradar.source.chain;

import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolRecord;
import com.poolradar.domain.TokenInfo;
import com.poolradar.source.UpstreamException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Reads pool state straight from the pool factory and pool contracts with eth_call.
 * Only on-chain state is available this way: USD aggregates (volume, TVL, fees) and creation provenance
 * are left at zero.
 */
@Slf4j
public class EvmChainPoolSource implements ChainPoolSource {

    /** factory getPool(address,address,uint24) */
    static final String GET_POOL_SELECTOR = "0x1698ee82";
    /** pool slot0(): sqrtPriceX96, tick, ... */
    static final String SLOT0_SELECTOR = "0x3850c7bd";
    static final String LIQUIDITY_SELECTOR = "0x1a686502";
    static final String TICK_SPACING_SELECTOR = "0xd0c93a7c";
    static final String TOKEN0_SELECTOR = "0x0dfe1681";
    static final String TOKEN1_SELECTOR = "0xd21220a7";
    static final String FEE_SELECTOR = "0xddca3f43";
    static final String FEE_GROWTH_GLOBAL0_SELECTOR = "0xf3058399";
    static final String FEE_GROWTH_GLOBAL1_SELECTOR = "0x46141319";

    private final EthCallExecutor ethCall;
    private final TokenMetadataResolver tokenMetadataResolver;
    private final Map<Integer, String> factoryByChain;

    public EvmChainPoolSource(EthCallExecutor ethCall, TokenMetadataResolver tokenMetadataResolver, Map<Integer, String> factoryByChain) {
        this.ethCall = ethCall;
        this.tokenMetadataResolver = tokenMetadataResolver;
        this.factoryByChain = Map.copyOf(factoryByChain);
    }

    @Override
    public boolean supports(int chainId) {
        return ethCall.supports(chainId) && factoryByChain.containsKey(chainId);
    }

    @Override
    public Optional<PoolRecord> getPoolOnChain(String tokenA, String tokenB, FeeTier feeTier, int chainId) {
        String factory = factoryByChain.get(chainId);
        if (factory == null) {
            throw new UpstreamException("No pool factory configured for chain " + chainId);
        }
        String data = AbiCodec.encodeCall(GET_POOL_SELECTOR,
                AbiCodec.addressWord(tokenA), AbiCodec.addressWord(tokenB), AbiCodec.uintWord(feeTier.value()));
        String result = ethCall.ethCall(chainId, factory, data);
        if (AbiCodec.isEmptyResult(result)) {
            return Optional.empty();
        }
        String poolAddress = AbiCodec.addressAt(result, 0);
        if (AbiCodec.ZERO_ADDRESS.equals(poolAddress)) {
            log.debug("Factory has no pool for {}/{} fee {} on chain {}", tokenA, tokenB, feeTier.value(), chainId);
            return Optional.empty();
        }
        return Optional.of(readPool(poolAddress, tokenA, tokenB, feeTier, chainId));
    }

    @Override
    public Optional<PoolRecord> getPoolOnChainByAddress(String poolAddress, int chainId) {
        String address = poolAddress.strip().toLowerCase();
        String token0 = ethCall.ethCall(chainId, address, TOKEN0_SELECTOR);
        if (AbiCodec.isEmptyResult(token0)) {
            return Optional.empty();
        }
        String token1 = ethCall.ethCall(chainId, address, TOKEN1_SELECTOR);
        String fee = ethCall.ethCall(chainId, address, FEE_SELECTOR);
        if (AbiCodec.isEmptyResult(token1) || AbiCodec.isEmptyResult(fee)) {
            return Optional.empty();
        }
        int feeValue = AbiCodec.uintAt(fee, 0).intValue();
        Optional<FeeTier> feeTier = FeeTier.fromValue(feeValue);
        if (feeTier.isEmpty()) {
            log.debug("Contract {} on chain {} reports unsupported fee {}", address, chainId, feeValue);
            return Optional.empty();
        }
        return Optional.of(readPool(address, AbiCodec.addressAt(token0, 0), AbiCodec.addressAt(token1, 0), feeTier.get(), chainId));
    }

    private PoolRecord readPool(String poolAddress, String tokenA, String tokenB, FeeTier feeTier, int chainId) {
        String slot0 = ethCall.ethCall(chainId, poolAddress, SLOT0_SELECTOR);
        if (AbiCodec.wordCount(slot0) < 2) {
            throw new UpstreamException("Malformed slot0 for pool " + poolAddress + " on chain " + chainId);
        }
        BigInteger liquidity = AbiCodec.uintAt(ethCall.ethCall(chainId, poolAddress, LIQUIDITY_SELECTOR), 0);
        int tickSpacing = AbiCodec.intAt(ethCall.ethCall(chainId, poolAddress, TICK_SPACING_SELECTOR), 0).intValue();
        BigInteger feeGrowth0 = AbiCodec.uintAt(ethCall.ethCall(chainId, poolAddress, FEE_GROWTH_GLOBAL0_SELECTOR), 0);
        BigInteger feeGrowth1 = AbiCodec.uintAt(ethCall.ethCall(chainId, poolAddress, FEE_GROWTH_GLOBAL1_SELECTOR), 0);
        TokenInfo token0 = tokenMetadataResolver.resolve(chainId, tokenA);
        TokenInfo token1 = tokenMetadataResolver.resolve(chainId, tokenB);
        // fee growth is indexed by the pool's own token0/token1, which is the canonical order
        boolean swapped = token0.address().compareTo(token1.address()) > 0;
        return PoolRecord.builder()
                .address(poolAddress)
                .chainId(chainId)
                .tokenA(swapped ? token1 : token0)
                .tokenB(swapped ? token0 : token1)
                .feeTier(feeTier)
                .sqrtPriceX96(AbiCodec.uintAt(slot0, 0))
                .tick(AbiCodec.intAt(slot0, 1).intValue())
                .tickSpacing(tickSpacing)
                .liquidity(liquidity)
                .feeGrowthGlobalAX128(feeGrowth0)
                .feeGrowthGlobalBX128(feeGrowth1)
                .build();
    }
}
