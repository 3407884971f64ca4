package com.poolradar.resolver;

import com.poolradar.domain.FeeTier;

/**
 * One element of a batch lookup: either a pool address, or a token pair with fee tier, on a chain.
 */
public record PoolLookupRequest(String address, String tokenA, String tokenB, FeeTier feeTier, int chainId) {

    public static PoolLookupRequest byAddress(String address, int chainId) {
        return new PoolLookupRequest(address, null, null, null, chainId);
    }

    public static PoolLookupRequest byTokens(String tokenA, String tokenB, FeeTier feeTier, int chainId) {
        return new PoolLookupRequest(null, tokenA, tokenB, feeTier, chainId);
    }

    public boolean isAddressLookup() {
        return address != null && !address.isBlank();
    }

    /** Short label used in batch error messages. */
    public String describe() {
        if (isAddressLookup()) {
            return address + "@" + chainId;
        }
        return tokenA + "/" + tokenB + "/" + (feeTier != null ? feeTier.value() : "?") + "@" + chainId;
    }
}
