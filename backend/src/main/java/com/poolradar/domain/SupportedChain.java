package com.poolradar.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * EVM networks with a known pool deployment. Pools are chain-scoped; the numeric id is part of every cache key.
 */
public enum SupportedChain {
    ETHEREUM(1),
    OPTIMISM(10),
    BSC(56),
    POLYGON(137),
    BASE(8453),
    ARBITRUM(42161);

    private final int chainId;

    SupportedChain(int chainId) {
        this.chainId = chainId;
    }

    public int chainId() {
        return chainId;
    }

    public static Optional<SupportedChain> fromChainId(int chainId) {
        return Arrays.stream(values()).filter(c -> c.chainId == chainId).findFirst();
    }

    public static boolean isSupported(int chainId) {
        return fromChainId(chainId).isPresent();
    }
}
