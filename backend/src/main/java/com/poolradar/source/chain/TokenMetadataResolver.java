package com.poolradar.source.chain;

import com.poolradar.domain.TokenInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.Map;

/**
 * Resolves ERC20 decimals, symbol and name via eth_call. Cached per (chainId, tokenAddress) in the Caffeine
 * tokenMetaCache (TTL 24h, max 5000). Falls back to 18 decimals and empty strings when a call fails.
 */
@Slf4j
public class TokenMetadataResolver {

    /** Caffeine cache holding resolved token metadata, keyed by chainId:address. */
    public static final String CACHE_NAME = "tokenMetaCache";

    /** ERC20 decimals() selector: keccak256("decimals()") first 4 bytes. */
    static final String DECIMALS_SELECTOR = "0x313ce567";
    /** ERC20 symbol() selector. */
    static final String SYMBOL_SELECTOR = "0x95d89b41";
    /** ERC20 name() selector. */
    static final String NAME_SELECTOR = "0x06fdde03";

    /** Default when contract is not ERC20 or RPC fails. */
    public static final int DEFAULT_DECIMALS = 18;

    private static final Map<String, Integer> KNOWN_DECIMALS = Map.of(
            "1:0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", 6,
            "1:0xdac17f958d2ee523a2206206994597c13d831ec7", 6,
            "1:0x2260fac5e5542a773aa44fbcfedf7c193bc2c599", 8,
            "42161:0xaf88d065e77c8cc2239327c5edb3a432268e5831", 6,
            "8453:0x833589fcd6edb6e08f4c7c32d4f71b54bda02913", 6,
            "10:0x0b2c639c533813f4aa9d7837caf62653d097ff85", 6,
            "137:0x3c499c542cef5e3811e1192ce70d8cc03d5c3359", 6
    );

    private final EthCallExecutor ethCall;
    private final CacheManager cacheManager;

    public TokenMetadataResolver(EthCallExecutor ethCall, CacheManager cacheManager) {
        this.ethCall = ethCall;
        this.cacheManager = cacheManager;
    }

    static String cacheKey(int chainId, String tokenAddress) {
        return chainId + ":" + tokenAddress.toLowerCase();
    }

    public TokenInfo resolve(int chainId, String tokenAddress) {
        Cache cache = cacheManager != null ? cacheManager.getCache(CACHE_NAME) : null;
        if (cache == null) {
            return fetch(chainId, tokenAddress);
        }
        return cache.get(cacheKey(chainId, tokenAddress), () -> fetch(chainId, tokenAddress));
    }

    private TokenInfo fetch(int chainId, String tokenAddress) {
        int decimals = fetchDecimals(chainId, tokenAddress);
        String symbol = fetchString(chainId, tokenAddress, SYMBOL_SELECTOR, "symbol");
        String name = fetchString(chainId, tokenAddress, NAME_SELECTOR, "name");
        return new TokenInfo(tokenAddress, symbol, name, decimals);
    }

    private int fetchDecimals(int chainId, String tokenAddress) {
        Integer known = KNOWN_DECIMALS.get(cacheKey(chainId, tokenAddress));
        if (known != null) return known;
        try {
            String result = ethCall.ethCall(chainId, tokenAddress, DECIMALS_SELECTOR);
            if (AbiCodec.isEmptyResult(result)) return DEFAULT_DECIMALS;
            int decimals = AbiCodec.uintAt(result, 0).intValue();
            if (decimals < 0 || decimals > 255) return DEFAULT_DECIMALS;
            return decimals;
        } catch (RuntimeException e) {
            log.debug("Failed to get decimals for {} on chain {}: {}", tokenAddress, chainId, e.getMessage());
            return DEFAULT_DECIMALS;
        }
    }

    private String fetchString(int chainId, String tokenAddress, String selector, String what) {
        try {
            String result = ethCall.ethCall(chainId, tokenAddress, selector);
            return AbiCodec.isEmptyResult(result) ? "" : AbiCodec.decodeString(result);
        } catch (RuntimeException e) {
            log.debug("Failed to get {} for {} on chain {}: {}", what, tokenAddress, chainId, e.getMessage());
            return "";
        }
    }
}
