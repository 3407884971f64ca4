package com.poolradar.source.indexed;

import com.poolradar.domain.FeeTier;
import com.poolradar.domain.PoolRecord;

import java.util.List;
import java.util.Optional;

/**
 * Indexed ledger service answering pool queries per chain. Transport, timeout and response-shape failures
 * are thrown as {@link com.poolradar.source.UpstreamException}; an empty Optional means the service
 * answered that no such pool exists.
 */
public interface IndexedPoolService {

    boolean supports(int chainId);

    Optional<PoolRecord> getPool(String poolAddress, int chainId);

    List<PoolRecord> getPools(int chainId, PoolQuery query);

    /**
     * Token order does not matter; tokens are canonicalized before querying.
     */
    Optional<PoolRecord> getPoolByTokens(String tokenA, String tokenB, FeeTier feeTier, int chainId);
}
