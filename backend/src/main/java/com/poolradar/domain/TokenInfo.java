package com.poolradar.domain;

/**
 * ERC20 token as seen by a pool. Address is normalized to lowercase.
 */
public record TokenInfo(String address, String symbol, String name, int decimals) {

    public TokenInfo {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("token address is required");
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative");
        }
        address = address.strip().toLowerCase();
        symbol = symbol != null ? symbol : "";
        name = name != null ? name : "";
    }

    public static TokenInfo ofAddress(String address) {
        return new TokenInfo(address, "", "", 18);
    }
}
