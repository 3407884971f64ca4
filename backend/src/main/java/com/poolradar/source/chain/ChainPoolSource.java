package com.poolradar.source.chain;

import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolRecord;

import java.util.Optional;

/**
 * Direct-chain pool reads, used only after the indexed service has failed. Best-effort: empty when the chain
 * has no such pool, {@link com.poolradar.source.UpstreamException} when the chain could not be read.
 */
public interface ChainPoolSource {

    boolean supports(int chainId);

    Optional<PoolRecord> getPoolOnChain(String tokenA, String tokenB, FeeTier feeTier, int chainId);

    Optional<PoolRecord> getPoolOnChainByAddress(String poolAddress, int chainId);
}
